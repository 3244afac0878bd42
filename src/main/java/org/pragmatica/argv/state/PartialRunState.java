package org.pragmatica.argv.state;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Optional;

/**
 * Sparse version of {@link RunState}: only present fields are applied by {@link #applyTo(RunState)}.
 *
 * <p>Used to adopt the results of a previously explored candidate into the active state.
 * The error message and selection are optional in the state itself, so here they are present
 * either with a value or as an explicit "cleared" marker ({@code Optional.of(Optional.empty())}).
 */
public record PartialRunState(
    Optional<Boolean> ignoreOptions,
    Optional<ImmutableList<OptionBinding>> options,
    Optional<ImmutableList<Positional>> positionals,
    Optional<ImmutableList<Token>> tokens,
    Optional<ImmutableList<String>> path,
    Optional<Optional<String>> errorMessage,
    Optional<Optional<Selection>> selection
) {
    private static final PartialRunState EMPTY = builder().build();

    public static PartialRunState empty() {
        return EMPTY;
    }

    /**
     * Snapshot with every field present, so that applying it replaces the whole target state.
     * A source without error message or selection clears them on the target.
     */
    public static PartialRunState of(RunState state) {
        return new PartialRunState(
            Optional.of(state.ignoreOptions()),
            Optional.of(state.options()),
            Optional.of(state.positionals()),
            Optional.of(state.tokens()),
            Optional.of(state.path()),
            Optional.of(state.errorMessage()),
            Optional.of(state.selection())
        );
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return ignoreOptions.isEmpty()
               && options.isEmpty()
               && positionals.isEmpty()
               && tokens.isEmpty()
               && path.isEmpty()
               && errorMessage.isEmpty()
               && selection.isEmpty();
    }

    /**
     * Overlay the present fields onto the given state, leaving absent ones untouched.
     */
    public RunState applyTo(RunState state) {
        var result = state;
        if (ignoreOptions.isPresent()) {
            result = result.withIgnoreOptions(ignoreOptions.get());
        }
        if (options.isPresent()) {
            result = result.withOptions(options.get());
        }
        if (positionals.isPresent()) {
            result = result.withPositionals(positionals.get());
        }
        if (tokens.isPresent()) {
            result = result.withTokens(tokens.get());
        }
        if (path.isPresent()) {
            result = result.withPath(path.get());
        }
        if (errorMessage.isPresent()) {
            result = result.withErrorMessage(errorMessage.get());
        }
        if (selection.isPresent()) {
            result = result.withSelection(selection.get());
        }
        return result;
    }

    public static final class Builder {
        private Optional<Boolean> ignoreOptions = Optional.empty();
        private Optional<ImmutableList<OptionBinding>> options = Optional.empty();
        private Optional<ImmutableList<Positional>> positionals = Optional.empty();
        private Optional<ImmutableList<Token>> tokens = Optional.empty();
        private Optional<ImmutableList<String>> path = Optional.empty();
        private Optional<Optional<String>> errorMessage = Optional.empty();
        private Optional<Optional<Selection>> selection = Optional.empty();

        private Builder() {}

        public Builder ignoreOptions(boolean value) {
            this.ignoreOptions = Optional.of(value);
            return this;
        }

        public Builder options(List<OptionBinding> value) {
            this.options = Optional.of(ImmutableList.copyOf(value));
            return this;
        }

        public Builder positionals(List<Positional> value) {
            this.positionals = Optional.of(ImmutableList.copyOf(value));
            return this;
        }

        public Builder tokens(List<Token> value) {
            this.tokens = Optional.of(ImmutableList.copyOf(value));
            return this;
        }

        public Builder path(List<String> value) {
            this.path = Optional.of(ImmutableList.copyOf(value));
            return this;
        }

        public Builder errorMessage(String value) {
            this.errorMessage = Optional.of(Optional.of(value));
            return this;
        }

        public Builder clearErrorMessage() {
            this.errorMessage = Optional.of(Optional.empty());
            return this;
        }

        public Builder selection(Selection value) {
            this.selection = Optional.of(Optional.of(value));
            return this;
        }

        public Builder clearSelection() {
            this.selection = Optional.of(Optional.empty());
            return this;
        }

        public PartialRunState build() {
            return new PartialRunState(ignoreOptions, options, positionals, tokens, path, errorMessage, selection);
        }
    }
}
