package org.pragmatica.argv.transition;

import com.google.common.base.Preconditions;

/**
 * Label of one matcher graph edge: the reducer runs when the check holds.
 */
public record Transition(Check check, Reducer reducer) {

    public Transition {
        Preconditions.checkNotNull(check, "check");
        Preconditions.checkNotNull(reducer, "reducer");
    }

    public static Transition of(Check check, Reducer reducer) {
        return new Transition(check, reducer);
    }

    public static Transition always(Reducer reducer) {
        return new Transition(Check.always(), reducer);
    }
}
