package org.pragmatica.argv.state;

import com.google.common.base.Preconditions;

/**
 * Which declared command a state is a candidate for.
 *
 * <p>The numeric form used by compiled grammars reserves {@code -1} for the built-in help
 * command; every other negative value is meaningless and rejected.
 */
public sealed interface Selection {

    long HELP_INDEX = -1;

    long toIndex();

    static Selection command(int index) {
        return new Command(index);
    }

    static Selection help() {
        return Help.INSTANCE;
    }

    static Selection fromIndex(long index) {
        if (index == HELP_INDEX) {
            return help();
        }
        Preconditions.checkArgument(index >= 0 && index <= Integer.MAX_VALUE, "Invalid command index %s", index);
        return command((int) index);
    }

    /**
     * A declared command, by declaration order.
     */
    record Command(int index) implements Selection {
        public Command {
            Preconditions.checkArgument(index >= 0, "Negative command index %s", index);
        }

        @Override
        public long toIndex() {
            return index;
        }
    }

    /**
     * The help command. The command help was requested for is carried by the help-redirect option.
     */
    record Help() implements Selection {
        static final Help INSTANCE = new Help();

        @Override
        public long toIndex() {
            return HELP_INDEX;
        }
    }
}
