package org.pragmatica.argv.state;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RunState updates and their independence from the original state.
 */
class RunStateTest {

    @Test
    void initial_isEmpty() {
        var state = RunState.initial();

        assertFalse(state.ignoreOptions());
        assertTrue(state.options().isEmpty());
        assertTrue(state.positionals().isEmpty());
        assertTrue(state.tokens().isEmpty());
        assertTrue(state.path().isEmpty());
        assertFalse(state.hasError());
        assertEquals(Optional.empty(), state.selection());
    }

    @Test
    void withOption_appendsAndLeavesOriginalUnchanged() {
        var original = RunState.initial().withOption(OptionBinding.of("-a", OptionValue.bool(true)));

        var updated = original.withOption(OptionBinding.of("-a", OptionValue.bool(false)));

        assertEquals(1, original.options().size());
        assertThat(updated.options()).containsExactly(
            OptionBinding.of("-a", OptionValue.bool(true)),
            OptionBinding.of("-a", OptionValue.bool(false)));
    }

    @Test
    void lastOption_withoutOptions_throws() {
        assertThrows(IllegalStateException.class, () -> RunState.initial().lastOption());
    }

    @Test
    void withLastOptionValue_replacesOnlyLastBinding() {
        var state = RunState.initial()
                            .withOption(OptionBinding.of("--a", OptionValue.none()))
                            .withOption(OptionBinding.of("--b", OptionValue.none()));

        var updated = state.withLastOptionValue(OptionValue.text("x"));

        assertEquals(OptionValue.none(), updated.options().get(0).value());
        assertEquals(OptionValue.text("x"), updated.lastOption().value());
        assertEquals(OptionValue.none(), state.lastOption().value());
    }

    @Test
    void withToken_decreasingSegmentIndex_rejected() {
        var state = RunState.initial().withToken(Token.wholeValue(3));

        assertThrows(IllegalArgumentException.class, () -> state.withToken(Token.wholeValue(2)));
        assertEquals(2, state.withToken(Token.wholeValue(3)).tokens().size());
    }

    @Test
    void constructor_copiesMutableInput() {
        var path = new ArrayList<>(List.of("git"));
        var state = RunState.initial().withPath(path);

        path.add("commit");

        assertThat(state.path()).containsExactly("git");
    }

    @Test
    void withErrorMessage_marksStateAsFailed() {
        var state = RunState.initial().withErrorMessage("Command not found.");

        assertTrue(state.hasError());
        assertEquals(Optional.of("Command not found."), state.errorMessage());
        assertFalse(RunState.initial().hasError());
    }

    @Test
    void withSelection_andPathSegment_areIndependentUpdates() {
        var base = RunState.initial().withPathSegment("git");

        var selected = base.withSelection(Selection.command(1));
        var extended = base.withPathSegment("commit");

        assertEquals(Optional.of(Selection.command(1)), selected.selection());
        assertThat(selected.path()).containsExactly("git");
        assertThat(extended.path()).containsExactly("git", "commit");
        assertEquals(Optional.empty(), extended.selection());
    }

    @Test
    void optionValueArray_append_returnsNewArray() {
        var array = (OptionValue.Array) OptionValue.array(List.of("a"));

        var appended = array.append("b");

        assertThat(array.values()).containsExactly("a");
        assertThat(appended.values()).containsExactly("a", "b");
    }
}
