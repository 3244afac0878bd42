package org.pragmatica.argv;

import org.pragmatica.argv.matcher.MatcherConfig;
import org.pragmatica.argv.matcher.MatcherCore;

/**
 * Entry point for obtaining the matcher core.
 *
 * <p>Example usage:
 * <pre>{@code
 * var core = ArgvMatcher.core();
 * var state = RunState.initial();
 * var arg = Arg.user("--name=value");
 *
 * if (core.applyCheck(Check.isBoundOption(Set.of("--name")), state, arg, 0)) {
 *     state = core.applyReducer(new Reducer.PushBound(), state, arg, 0);
 * }
 * }</pre>
 */
public final class ArgvMatcher {
    private static final MatcherCore DEFAULT_CORE = MatcherCore.create(MatcherConfig.DEFAULT);

    private ArgvMatcher() {}

    /**
     * Core using the default configuration.
     */
    public static MatcherCore core() {
        return DEFAULT_CORE;
    }

    /**
     * Core using custom configuration.
     */
    public static MatcherCore core(MatcherConfig config) {
        return MatcherCore.create(config);
    }
}
