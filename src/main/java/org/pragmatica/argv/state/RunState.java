package org.pragmatica.argv.state;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Optional;

/**
 * Parse state threaded through every matcher step.
 *
 * <p>Instances are immutable: every {@code with*} method returns a new state and leaves the
 * receiver untouched, so a state can be held by several candidate lineages at once.
 *
 * @param ignoreOptions when set, option-sensitive checks treat every argument as non-option-like
 * @param options       option occurrences in encounter order; a name may repeat
 * @param positionals   bare arguments in encounter order
 * @param tokens        diagnostic tokens, non-decreasing in segment index
 * @param path          accumulated subcommand path
 * @param errorMessage  set once a lineage has failed to match
 * @param selection     command this state is a candidate for
 */
public record RunState(
    boolean ignoreOptions,
    ImmutableList<OptionBinding> options,
    ImmutableList<Positional> positionals,
    ImmutableList<Token> tokens,
    ImmutableList<String> path,
    Optional<String> errorMessage,
    Optional<Selection> selection
) {
    private static final RunState INITIAL = new RunState(
        false,
        ImmutableList.of(),
        ImmutableList.of(),
        ImmutableList.of(),
        ImmutableList.of(),
        Optional.empty(),
        Optional.empty()
    );

    public RunState {
        options = ImmutableList.copyOf(options);
        positionals = ImmutableList.copyOf(positionals);
        tokens = ImmutableList.copyOf(tokens);
        path = ImmutableList.copyOf(path);
        Preconditions.checkNotNull(errorMessage, "errorMessage");
        Preconditions.checkNotNull(selection, "selection");
    }

    public static RunState initial() {
        return INITIAL;
    }

    public boolean hasError() {
        return errorMessage.isPresent();
    }

    /**
     * Most recently pushed option.
     *
     * @throws IllegalStateException when no option has been pushed yet
     */
    public OptionBinding lastOption() {
        Preconditions.checkState(!options.isEmpty(), "No option has been pushed");
        return options.get(options.size() - 1);
    }

    // === Updates ===

    public RunState withIgnoreOptions(boolean ignore) {
        return new RunState(ignore, options, positionals, tokens, path, errorMessage, selection);
    }

    public RunState withOption(OptionBinding option) {
        return withOptions(append(options, option));
    }

    public RunState withOptions(List<OptionBinding> newOptions) {
        return new RunState(ignoreOptions, ImmutableList.copyOf(newOptions), positionals, tokens, path, errorMessage, selection);
    }

    /**
     * Replace the value of the most recently pushed option.
     */
    public RunState withLastOptionValue(OptionValue value) {
        var last = lastOption();
        var updated = ImmutableList.<OptionBinding>builderWithExpectedSize(options.size())
                                   .addAll(options.subList(0, options.size() - 1))
                                   .add(last.withValue(value))
                                   .build();
        return withOptions(updated);
    }

    public RunState withPositional(Positional positional) {
        return new RunState(ignoreOptions, options, append(positionals, positional), tokens, path, errorMessage, selection);
    }

    public RunState withToken(Token token) {
        if (!tokens.isEmpty()) {
            var previous = tokens.get(tokens.size() - 1).segmentIndex();
            Preconditions.checkArgument(token.segmentIndex() >= previous,
                                        "Token for segment %s recorded after segment %s",
                                        token.segmentIndex(),
                                        previous);
        }
        return withTokens(append(tokens, token));
    }

    public RunState withTokens(List<Token> newTokens) {
        return new RunState(ignoreOptions, options, positionals, ImmutableList.copyOf(newTokens), path, errorMessage, selection);
    }

    public RunState withPositionals(List<Positional> newPositionals) {
        return new RunState(ignoreOptions, options, ImmutableList.copyOf(newPositionals), tokens, path, errorMessage, selection);
    }

    public RunState withPathSegment(String segment) {
        return withPath(append(path, segment));
    }

    public RunState withPath(List<String> newPath) {
        return new RunState(ignoreOptions, options, positionals, tokens, ImmutableList.copyOf(newPath), errorMessage, selection);
    }

    public RunState withErrorMessage(String message) {
        return withErrorMessage(Optional.of(message));
    }

    public RunState withErrorMessage(Optional<String> message) {
        return new RunState(ignoreOptions, options, positionals, tokens, path, message, selection);
    }

    public RunState withSelection(Selection newSelection) {
        return withSelection(Optional.of(newSelection));
    }

    public RunState withSelection(Optional<Selection> newSelection) {
        return new RunState(ignoreOptions, options, positionals, tokens, path, errorMessage, newSelection);
    }

    private static <T> ImmutableList<T> append(ImmutableList<T> list, T element) {
        return ImmutableList.<T>builderWithExpectedSize(list.size() + 1)
                            .addAll(list)
                            .add(element)
                            .build();
    }
}
