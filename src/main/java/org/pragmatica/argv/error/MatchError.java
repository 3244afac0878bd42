package org.pragmatica.argv.error;

import org.pragmatica.argv.state.Arg;

/**
 * User input error ending a candidate lineage. Its {@link #message()} becomes the state's error message.
 */
public sealed interface MatchError {

    String message();

    /**
     * Standard reasons reported by compiled grammars.
     */
    enum Reason {
        EXTRANEOUS_POSITIONAL("Extraneous positional argument"),
        MISSING_POSITIONAL("Not enough positional arguments"),
        UNSUPPORTED_OPTION("Unsupported option name"),
        INVALID_OPTION("Invalid option name"),
        COMMAND_NOT_FOUND("Command not found");

        private final String text;

        Reason(String text) {
            this.text = text;
        }

        public String text() {
            return text;
        }
    }

    /**
     * Input rejected at the given argument. Boundary sentinels have no text to quote.
     */
    record Unexpected(String description, Arg arg) implements MatchError {
        public Unexpected(Reason reason, Arg arg) {
            this(reason.text(), arg);
        }

        @Override
        public String message() {
            if (arg.isBoundary()) {
                return description + ".";
            }
            return description + " (\"" + arg.unwrapUser() + "\").";
        }
    }

    /**
     * The input ended, or an option was met, before an option received all its values.
     */
    record NotEnoughArguments(String optionName) implements MatchError {
        @Override
        public String message() {
            return "Not enough arguments to option " + optionName + ".";
        }
    }
}
