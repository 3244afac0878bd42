package org.pragmatica.argv.state;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for overlaying sparse candidate state onto a run state.
 */
class PartialRunStateTest {

    @Test
    void empty_applyTo_leavesStateUnchanged() {
        var state = populated();

        assertTrue(PartialRunState.empty().isEmpty());
        assertEquals(state, PartialRunState.empty().applyTo(state));
    }

    @Test
    void errorMessageOnly_applyTo_leavesOtherFieldsUnchanged() {
        var state = populated();
        var partial = PartialRunState.builder()
                                     .errorMessage("Extraneous positional argument (\"x\").")
                                     .build();

        var result = partial.applyTo(state);

        assertEquals(Optional.of("Extraneous positional argument (\"x\")."), result.errorMessage());
        assertEquals(state.ignoreOptions(), result.ignoreOptions());
        assertEquals(state.options(), result.options());
        assertEquals(state.positionals(), result.positionals());
        assertEquals(state.tokens(), result.tokens());
        assertEquals(state.path(), result.path());
        assertEquals(state.selection(), result.selection());
        assertFalse(state.hasError());
    }

    @Test
    void optionsOnly_applyTo_replacesWholeOptionList() {
        var partial = PartialRunState.builder()
                                     .options(List.of(OptionBinding.of("--only", OptionValue.bool(true))))
                                     .build();

        var result = partial.applyTo(populated());

        assertThat(result.options()).containsExactly(OptionBinding.of("--only", OptionValue.bool(true)));
        assertThat(result.path()).containsExactly("build");
    }

    @Test
    void of_snapshot_reproducesSourceState() {
        var candidate = populated().withSelection(Selection.command(2))
                                   .withErrorMessage("Not enough positional arguments.");

        var adopted = PartialRunState.of(candidate).applyTo(RunState.initial().withPathSegment("other"));

        assertEquals(candidate, adopted);
    }

    @Test
    void of_snapshotWithoutErrorOrSelection_clearsThemOnTarget() {
        var winner = RunState.initial().withPathSegment("cp");
        var active = RunState.initial()
                             .withErrorMessage("Command not found (\"cp\").")
                             .withSelection(Selection.command(1));

        assertEquals(winner, PartialRunState.of(winner).applyTo(active));
    }

    @Test
    void of_snapshot_reproducesSourceForAnyTarget() {
        var sources = List.of(RunState.initial(),
                              populated(),
                              populated().withIgnoreOptions(true).withSelection(Selection.help()),
                              populated().withErrorMessage("Not enough positional arguments."));
        var targets = List.of(RunState.initial(),
                              populated().withErrorMessage("Command not found."),
                              RunState.initial().withSelection(Selection.command(3)).withPathSegment("stale"));

        for (var source : sources) {
            for (var target : targets) {
                assertEquals(source, PartialRunState.of(source).applyTo(target));
            }
        }
    }

    @Test
    void builder_clearErrorAndSelection_removesThem() {
        var partial = PartialRunState.builder()
                                     .clearErrorMessage()
                                     .clearSelection()
                                     .build();
        var state = populated().withErrorMessage("Command not found.").withSelection(Selection.help());

        var result = partial.applyTo(state);

        assertFalse(result.hasError());
        assertEquals(Optional.empty(), result.selection());
        assertEquals(populated(), result);
        assertFalse(partial.isEmpty());
    }

    @Test
    void builder_ignoreOptionsAndSelection_applied() {
        var partial = PartialRunState.builder()
                                     .ignoreOptions(true)
                                     .selection(Selection.help())
                                     .build();

        var result = partial.applyTo(RunState.initial());

        assertTrue(result.ignoreOptions());
        assertEquals(Optional.of(Selection.help()), result.selection());
        assertFalse(partial.isEmpty());
    }

    private static RunState populated() {
        return RunState.initial()
                       .withPathSegment("build")
                       .withOption(OptionBinding.of("--target", OptionValue.text("all")))
                       .withToken(Token.implicitOption(1, "--target"))
                       .withPositional(new Positional.Required("src"));
    }
}
