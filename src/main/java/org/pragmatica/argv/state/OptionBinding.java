package org.pragmatica.argv.state;

import com.google.common.base.Preconditions;

/**
 * One option occurrence: the name as it was matched and its current value.
 */
public record OptionBinding(String name, OptionValue value) {

    public OptionBinding {
        Preconditions.checkNotNull(name, "name");
        Preconditions.checkNotNull(value, "value");
    }

    public static OptionBinding of(String name, OptionValue value) {
        return new OptionBinding(name, value);
    }

    public OptionBinding withValue(OptionValue newValue) {
        return new OptionBinding(name, newValue);
    }
}
