package org.pragmatica.argv.matcher;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

/**
 * Matcher configuration options.
 *
 * @param helpNames         arguments requesting help
 * @param helpBoundPrefix   prefix of a help request carrying an inline topic, e.g. {@code --help=topic}
 * @param helpCommandOption option through which a help redirection names the target command
 */
public record MatcherConfig(
    ImmutableSet<String> helpNames,
    String helpBoundPrefix,
    String helpCommandOption
) {
    public static final MatcherConfig DEFAULT = new MatcherConfig(
        ImmutableSet.of("--help", "-h"),
        "--help=",
        "-c"
    );

    public MatcherConfig {
        helpNames = ImmutableSet.copyOf(helpNames);
        Preconditions.checkArgument(!helpBoundPrefix.isEmpty(), "Empty help prefix");
        Preconditions.checkArgument(!helpCommandOption.isEmpty(), "Empty help command option");
    }

    public MatcherConfig withHelpNames(String... names) {
        return new MatcherConfig(ImmutableSet.copyOf(names), helpBoundPrefix, helpCommandOption);
    }

    public MatcherConfig withHelpCommandOption(String option) {
        return new MatcherConfig(helpNames, helpBoundPrefix, option);
    }
}
