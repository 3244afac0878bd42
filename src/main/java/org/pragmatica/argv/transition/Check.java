package org.pragmatica.argv.transition;

import com.google.common.collect.ImmutableSet;
import org.pragmatica.argv.matcher.MatcherConfig;
import org.pragmatica.argv.state.Arg;
import org.pragmatica.argv.state.RunState;

import java.util.Set;

/**
 * Guard of a matcher transition.
 *
 * <p>Checks are pure: evaluating one any number of times, in any order, has no observable effect.
 * Every check except {@link Always} reads the literal argument text and must only be evaluated on
 * user arguments; a boundary sentinel raises {@link IllegalStateException}.
 */
public sealed interface Check {

    boolean test(RunState state, Arg arg, int segmentIndex, MatcherConfig config);

    static Check always() {
        return Always.INSTANCE;
    }

    static Check isOptionLike() {
        return IsOptionLike.INSTANCE;
    }

    static Check isNotOptionLike() {
        return IsNotOptionLike.INSTANCE;
    }

    static Check isExact(String needle) {
        return new IsExact(needle);
    }

    static Check isExactString(String needle) {
        return new IsExactString(needle);
    }

    static Check isHelp() {
        return IsHelp.INSTANCE;
    }

    static Check isBatchOption(Set<String> options) {
        return new IsBatchOption(ImmutableSet.copyOf(options));
    }

    static Check isBoundOption(Set<String> options) {
        return new IsBoundOption(ImmutableSet.copyOf(options));
    }

    static Check isUnsupportedOption(Set<String> options) {
        return new IsUnsupportedOption(ImmutableSet.copyOf(options));
    }

    static Check isInvalidOption() {
        return IsInvalidOption.INSTANCE;
    }

    // === Unconditional ===

    record Always() implements Check {
        static final Always INSTANCE = new Always();

        @Override
        public boolean test(RunState state, Arg arg, int segmentIndex, MatcherConfig config) {
            return true;
        }
    }

    // === Argument shape ===

    record IsOptionLike() implements Check {
        static final IsOptionLike INSTANCE = new IsOptionLike();

        @Override
        public boolean test(RunState state, Arg arg, int segmentIndex, MatcherConfig config) {
            var text = arg.unwrapUser();
            return !state.ignoreOptions() && OptionSyntax.isOptionLike(text);
        }
    }

    /**
     * The lone {@code -} and everything after options were inhibited count as non-option-like.
     */
    record IsNotOptionLike() implements Check {
        static final IsNotOptionLike INSTANCE = new IsNotOptionLike();

        @Override
        public boolean test(RunState state, Arg arg, int segmentIndex, MatcherConfig config) {
            var text = arg.unwrapUser();
            return state.ignoreOptions() || !OptionSyntax.isOptionLike(text);
        }
    }

    /**
     * Literal match, e.g. a subcommand path segment or the {@code --} terminator.
     */
    record IsExact(String needle) implements Check {
        @Override
        public boolean test(RunState state, Arg arg, int segmentIndex, MatcherConfig config) {
            var text = arg.unwrapUser();
            return !state.ignoreOptions() && needle.equals(text);
        }
    }

    /**
     * Literal match against a declared option name.
     */
    record IsExactString(String needle) implements Check {
        @Override
        public boolean test(RunState state, Arg arg, int segmentIndex, MatcherConfig config) {
            var text = arg.unwrapUser();
            return !state.ignoreOptions() && needle.equals(text);
        }
    }

    record IsHelp() implements Check {
        static final IsHelp INSTANCE = new IsHelp();

        @Override
        public boolean test(RunState state, Arg arg, int segmentIndex, MatcherConfig config) {
            var text = arg.unwrapUser();
            return !state.ignoreOptions()
                   && (config.helpNames().contains(text) || text.startsWith(config.helpBoundPrefix()));
        }
    }

    // === Option classification ===

    record IsBatchOption(ImmutableSet<String> options) implements Check {
        @Override
        public boolean test(RunState state, Arg arg, int segmentIndex, MatcherConfig config) {
            var text = arg.unwrapUser();
            return !state.ignoreOptions() && OptionSyntax.isBatch(text, options);
        }
    }

    record IsBoundOption(ImmutableSet<String> options) implements Check {
        @Override
        public boolean test(RunState state, Arg arg, int segmentIndex, MatcherConfig config) {
            var text = arg.unwrapUser();
            return !state.ignoreOptions()
                   && OptionSyntax.boundName(text)
                                  .map(options::contains)
                                  .orElse(false);
        }
    }

    /**
     * Well-formed option that no declared option accepts.
     */
    record IsUnsupportedOption(ImmutableSet<String> options) implements Check {
        @Override
        public boolean test(RunState state, Arg arg, int segmentIndex, MatcherConfig config) {
            var text = arg.unwrapUser();
            return !state.ignoreOptions()
                   && text.startsWith(OptionSyntax.SHORT_PREFIX)
                   && OptionSyntax.isValidOption(text)
                   && !options.contains(text);
        }
    }

    /**
     * Dash-prefixed argument that is not a well-formed option name.
     */
    record IsInvalidOption() implements Check {
        static final IsInvalidOption INSTANCE = new IsInvalidOption();

        @Override
        public boolean test(RunState state, Arg arg, int segmentIndex, MatcherConfig config) {
            var text = arg.unwrapUser();
            return !state.ignoreOptions()
                   && text.startsWith(OptionSyntax.SHORT_PREFIX)
                   && !OptionSyntax.isValidOption(text);
        }
    }
}
