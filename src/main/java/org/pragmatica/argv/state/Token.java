package org.pragmatica.argv.state;

import com.google.common.base.Preconditions;

import java.util.Optional;

/**
 * Diagnostic record of how part of one argv element was interpreted.
 *
 * <p>A token without a slice covers its argument conceptually rather than a scanned sub-range,
 * e.g. an option bound from a default or a value taken from a whole separate argument.
 */
public sealed interface Token {

    /**
     * Index of the argv element that produced this token.
     */
    int segmentIndex();

    Optional<Slice> slice();

    static Token option(int segmentIndex, Slice slice, String optionName) {
        return new Option(segmentIndex, Optional.of(slice), optionName);
    }

    static Token implicitOption(int segmentIndex, String optionName) {
        return new Option(segmentIndex, Optional.empty(), optionName);
    }

    static Token assign(int segmentIndex, Slice slice) {
        return new Assign(segmentIndex, Optional.of(slice));
    }

    static Token value(int segmentIndex, Slice slice) {
        return new Value(segmentIndex, Optional.of(slice));
    }

    static Token wholeValue(int segmentIndex) {
        return new Value(segmentIndex, Optional.empty());
    }

    /**
     * Characters interpreted as an option name.
     */
    record Option(int segmentIndex, Optional<Slice> slice, String optionName) implements Token {
        public Option {
            Preconditions.checkArgument(segmentIndex >= 0, "Negative segment index %s", segmentIndex);
        }
    }

    /**
     * The {@code =} separating a bound option from its value. Always scanned, so always sliced.
     */
    record Assign(int segmentIndex, Optional<Slice> slice) implements Token {
        public Assign {
            Preconditions.checkArgument(segmentIndex >= 0, "Negative segment index %s", segmentIndex);
            Preconditions.checkArgument(slice.isPresent(), "Assign token requires a slice");
        }
    }

    /**
     * Characters interpreted as an option value.
     */
    record Value(int segmentIndex, Optional<Slice> slice) implements Token {
        public Value {
            Preconditions.checkArgument(segmentIndex >= 0, "Negative segment index %s", segmentIndex);
        }
    }
}
