package org.pragmatica.argv.transition;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.pragmatica.argv.error.MatchError;
import org.pragmatica.argv.matcher.MatcherConfig;
import org.pragmatica.argv.state.Arg;
import org.pragmatica.argv.state.OptionBinding;
import org.pragmatica.argv.state.OptionValue;
import org.pragmatica.argv.state.PartialRunState;
import org.pragmatica.argv.state.Positional;
import org.pragmatica.argv.state.RunState;
import org.pragmatica.argv.state.Selection;
import org.pragmatica.argv.state.Slice;
import org.pragmatica.argv.state.Token;

/**
 * State transformation performed when a matcher transition fires.
 *
 * <p>A reducer never modifies its input: the returned state is independent of the one passed in,
 * and earlier states stay valid for exploring other continuations.
 */
public sealed interface Reducer {

    RunState apply(RunState state, Arg arg, int segmentIndex, MatcherConfig config);

    static Reducer none() {
        return None.INSTANCE;
    }

    static Reducer setError(String message) {
        return new SetError(message);
    }

    static Reducer setError(MatchError.Reason reason) {
        return new SetError(reason.text());
    }

    record None() implements Reducer {
        static final None INSTANCE = new None();

        @Override
        public RunState apply(RunState state, Arg arg, int segmentIndex, MatcherConfig config) {
            return state;
        }
    }

    /**
     * Treat every following argument as non-option-like, e.g. after {@code --}.
     */
    record InhibitOptions() implements Reducer {
        @Override
        public RunState apply(RunState state, Arg arg, int segmentIndex, MatcherConfig config) {
            return state.withIgnoreOptions(true);
        }
    }

    // === Options ===

    /**
     * Expand a bundle like {@code -rf} into one {@code true} flag per character. The first flag's
     * token also covers the leading dash.
     */
    record PushBatch() implements Reducer {
        @Override
        public RunState apply(RunState state, Arg arg, int segmentIndex, MatcherConfig config) {
            var text = arg.unwrapUser();
            var result = state;

            for (int t = 1; t < text.length(); t++) {
                var name = OptionSyntax.shortName(text.charAt(t));
                var slice = t == 1
                            ? Slice.of(0, 2)
                            : Slice.of(t, t + 1);

                result = result.withOption(OptionBinding.of(name, OptionValue.bool(true)))
                               .withToken(Token.option(segmentIndex, slice, name));
            }
            return result;
        }
    }

    /**
     * Split {@code --name=value} at its first {@code =}.
     */
    record PushBound() implements Reducer {
        @Override
        public RunState apply(RunState state, Arg arg, int segmentIndex, MatcherConfig config) {
            var text = arg.unwrapUser();
            int assignAt = text.indexOf(OptionSyntax.ASSIGN);
            Preconditions.checkState(assignAt >= 0, "Bound option without '=': %s", text);
            var name = text.substring(0, assignAt);
            var value = text.substring(assignAt + 1);

            return state.withOption(OptionBinding.of(name, OptionValue.text(value)))
                        .withToken(Token.option(segmentIndex, Slice.of(0, assignAt), name))
                        .withToken(Token.assign(segmentIndex, Slice.of(assignAt, assignAt + 1)))
                        .withToken(Token.value(segmentIndex, Slice.of(assignAt + 1, text.length())));
        }
    }

    record PushTrue(String name) implements Reducer {
        @Override
        public RunState apply(RunState state, Arg arg, int segmentIndex, MatcherConfig config) {
            return pushImplicit(state, segmentIndex, name, OptionValue.bool(true));
        }
    }

    record PushFalse(String name) implements Reducer {
        @Override
        public RunState apply(RunState state, Arg arg, int segmentIndex, MatcherConfig config) {
            return pushImplicit(state, segmentIndex, name, OptionValue.bool(false));
        }
    }

    /**
     * Record the option with its value still pending.
     */
    record PushNone(String name) implements Reducer {
        @Override
        public RunState apply(RunState state, Arg arg, int segmentIndex, MatcherConfig config) {
            return pushImplicit(state, segmentIndex, name, OptionValue.none());
        }
    }

    /**
     * Attach the argument to the last option, accumulating into an array.
     */
    record PushStringValue() implements Reducer {
        @Override
        public RunState apply(RunState state, Arg arg, int segmentIndex, MatcherConfig config) {
            var text = arg.unwrapUser();
            var current = state.lastOption().value();
            OptionValue updated;

            if (current instanceof OptionValue.None) {
                updated = OptionValue.array(ImmutableList.of(text));
            } else if (current instanceof OptionValue.Array array) {
                updated = array.append(text);
            } else {
                throw new IllegalStateException("Cannot append a value to option "
                                                + state.lastOption().name() + " holding " + current);
            }

            return state.withLastOptionValue(updated)
                        .withToken(Token.wholeValue(segmentIndex));
        }
    }

    /**
     * Overwrite the last option's value with the argument.
     */
    record SetStringValue() implements Reducer {
        @Override
        public RunState apply(RunState state, Arg arg, int segmentIndex, MatcherConfig config) {
            var text = arg.unwrapUser();
            return state.withLastOptionValue(OptionValue.text(text))
                        .withToken(Token.wholeValue(segmentIndex));
        }
    }

    // === Positionals and path ===

    record PushPositional() implements Reducer {
        @Override
        public RunState apply(RunState state, Arg arg, int segmentIndex, MatcherConfig config) {
            return state.withPositional(new Positional.Required(arg.unwrapUser()));
        }
    }

    record PushExtra() implements Reducer {
        @Override
        public RunState apply(RunState state, Arg arg, int segmentIndex, MatcherConfig config) {
            return state.withPositional(new Positional.Optional(arg.unwrapUser()));
        }
    }

    record PushRest() implements Reducer {
        @Override
        public RunState apply(RunState state, Arg arg, int segmentIndex, MatcherConfig config) {
            return state.withPositional(new Positional.Rest(arg.unwrapUser()));
        }
    }

    record PushPath() implements Reducer {
        @Override
        public RunState apply(RunState state, Arg arg, int segmentIndex, MatcherConfig config) {
            return state.withPathSegment(arg.unwrapUser());
        }
    }

    // === Errors ===

    /**
     * Report the last option as missing values. The current argument is not consumed.
     */
    record SetOptionArityError() implements Reducer {
        @Override
        public RunState apply(RunState state, Arg arg, int segmentIndex, MatcherConfig config) {
            var error = new MatchError.NotEnoughArguments(state.lastOption().name());
            return state.withErrorMessage(error.message());
        }
    }

    record SetError(String message) implements Reducer {
        @Override
        public RunState apply(RunState state, Arg arg, int segmentIndex, MatcherConfig config) {
            return state.withErrorMessage(new MatchError.Unexpected(message, arg).message());
        }
    }

    // === Selection ===

    record SetSelectedIndex(Selection selection) implements Reducer {
        @Override
        public RunState apply(RunState state, Arg arg, int segmentIndex, MatcherConfig config) {
            return state.withSelection(selection);
        }
    }

    /**
     * Drop collected options in favour of a single help-redirect option naming the command.
     */
    record UseHelp(int commandIndex) implements Reducer {
        public UseHelp {
            Preconditions.checkArgument(commandIndex >= 0, "Command index must be non-negative: %s", commandIndex);
        }

        @Override
        public RunState apply(RunState state, Arg arg, int segmentIndex, MatcherConfig config) {
            var redirect = OptionBinding.of(config.helpCommandOption(), OptionValue.text(Integer.toString(commandIndex)));
            return state.withOptions(ImmutableList.of(redirect));
        }
    }

    /**
     * Adopt the fields of a previously explored candidate.
     */
    record SetCandidateState(PartialRunState candidate) implements Reducer {
        @Override
        public RunState apply(RunState state, Arg arg, int segmentIndex, MatcherConfig config) {
            return candidate.applyTo(state);
        }
    }

    private static RunState pushImplicit(RunState state, int segmentIndex, String name, OptionValue value) {
        return state.withOption(OptionBinding.of(name, value))
                    .withToken(Token.implicitOption(segmentIndex, name));
    }
}
