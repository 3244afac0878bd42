package org.pragmatica.argv.state;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * One unit of matcher input: a user supplied argument or one of the boundary sentinels.
 */
public sealed interface Arg {

    /**
     * Literal text of a user argument.
     *
     * @throws IllegalStateException when invoked on a boundary sentinel
     */
    String unwrapUser();

    /**
     * True for {@link EndOfInput} and {@link EndOfPartialInput}.
     */
    boolean isBoundary();

    static Arg user(String text) {
        return new User(text);
    }

    static Arg endOfInput() {
        return EndOfInput.INSTANCE;
    }

    static Arg endOfPartialInput() {
        return EndOfPartialInput.INSTANCE;
    }

    /**
     * Frame a raw argv as matcher input. Partial input (e.g. a line being completed) ends with
     * {@link EndOfPartialInput} instead of {@link EndOfInput}.
     */
    static ImmutableList<Arg> sequence(List<String> argv, boolean partial) {
        var builder = ImmutableList.<Arg>builderWithExpectedSize(argv.size() + 1);
        argv.forEach(text -> builder.add(user(text)));
        builder.add(partial ? endOfPartialInput() : endOfInput());
        return builder.build();
    }

    record User(String text) implements Arg {
        public User {
            Preconditions.checkNotNull(text, "text");
        }

        @Override
        public String unwrapUser() {
            return text;
        }

        @Override
        public boolean isBoundary() {
            return false;
        }
    }

    /**
     * End of the complete argument list.
     */
    record EndOfInput() implements Arg {
        static final EndOfInput INSTANCE = new EndOfInput();

        @Override
        public String unwrapUser() {
            throw new IllegalStateException("End of input carries no literal text");
        }

        @Override
        public boolean isBoundary() {
            return true;
        }
    }

    /**
     * End of an incomplete argument list.
     */
    record EndOfPartialInput() implements Arg {
        static final EndOfPartialInput INSTANCE = new EndOfPartialInput();

        @Override
        public String unwrapUser() {
            throw new IllegalStateException("End of partial input carries no literal text");
        }

        @Override
        public boolean isBoundary() {
            return true;
        }
    }
}
