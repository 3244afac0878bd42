package org.pragmatica.argv.matcher;

import com.google.common.base.Preconditions;
import org.pragmatica.argv.state.Arg;
import org.pragmatica.argv.state.RunState;
import org.pragmatica.argv.transition.Check;
import org.pragmatica.argv.transition.Reducer;
import org.pragmatica.argv.transition.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Evaluates checks and reducers on behalf of a transition engine.
 *
 * <p>Stateless apart from its configuration; a single instance may serve any number of
 * candidate lineages.
 */
public final class MatcherCore {
    private static final Logger log = LoggerFactory.getLogger(MatcherCore.class);

    private final MatcherConfig config;

    private MatcherCore(MatcherConfig config) {
        this.config = config;
    }

    public static MatcherCore create(MatcherConfig config) {
        return new MatcherCore(Preconditions.checkNotNull(config, "config"));
    }

    public MatcherConfig config() {
        return config;
    }

    /**
     * Evaluate a check. No observable effect, may be called speculatively.
     */
    public boolean applyCheck(Check check, RunState state, Arg arg, int segmentIndex) {
        Preconditions.checkArgument(segmentIndex >= 0, "Negative segment index %s", segmentIndex);
        return check.test(state, arg, segmentIndex, config);
    }

    /**
     * Apply a reducer, producing the next state. The given state remains valid.
     */
    public RunState applyReducer(Reducer reducer, RunState state, Arg arg, int segmentIndex) {
        Preconditions.checkArgument(segmentIndex >= 0, "Negative segment index %s", segmentIndex);
        var next = reducer.apply(state, arg, segmentIndex, config);

        if (log.isTraceEnabled()) {
            log.trace("Segment {}: {} on {}", segmentIndex, reducer, arg);
        }
        if (next.hasError() && !state.hasError()) {
            log.debug("Candidate {} failed at segment {}: {}",
                      next.selection().map(Object::toString).orElse("<unselected>"),
                      segmentIndex,
                      next.errorMessage().get());
        }
        return next;
    }

    /**
     * Fire a transition: the next state when its check holds, empty otherwise.
     */
    public Optional<RunState> fire(Transition transition, RunState state, Arg arg, int segmentIndex) {
        if (!applyCheck(transition.check(), state, arg, segmentIndex)) {
            return Optional.empty();
        }
        return Optional.of(applyReducer(transition.reducer(), state, arg, segmentIndex));
    }
}
