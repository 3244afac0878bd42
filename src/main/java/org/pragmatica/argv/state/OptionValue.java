package org.pragmatica.argv.state;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Value bound to an option occurrence.
 */
public sealed interface OptionValue {

    static OptionValue none() {
        return None.INSTANCE;
    }

    static OptionValue bool(boolean value) {
        return value ? Bool.TRUE : Bool.FALSE;
    }

    static OptionValue text(String value) {
        return new Text(value);
    }

    static OptionValue array(List<String> values) {
        return new Array(ImmutableList.copyOf(values));
    }

    /**
     * Option recognized, value still pending.
     */
    record None() implements OptionValue {
        static final None INSTANCE = new None();
    }

    record Bool(boolean value) implements OptionValue {
        static final Bool TRUE = new Bool(true);
        static final Bool FALSE = new Bool(false);
    }

    record Text(String value) implements OptionValue {
        public Text {
            Preconditions.checkNotNull(value, "value");
        }
    }

    /**
     * Values accumulated by a repeatable or multi-arity option, in encounter order.
     */
    record Array(ImmutableList<String> values) implements OptionValue {
        public Array {
            values = ImmutableList.copyOf(values);
        }

        public Array append(String value) {
            return new Array(ImmutableList.<String>builderWithExpectedSize(values.size() + 1)
                                          .addAll(values)
                                          .add(value)
                                          .build());
        }
    }
}
