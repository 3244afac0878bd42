package org.pragmatica.argv.state;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ArgTest {

    @Test
    void unwrapUser_userArgument_returnsText() {
        assertEquals("--name", Arg.user("--name").unwrapUser());
        assertFalse(Arg.user("").isBoundary());
    }

    @Test
    void unwrapUser_endOfInput_throws() {
        var arg = Arg.endOfInput();

        assertTrue(arg.isBoundary());
        assertThrows(IllegalStateException.class, arg::unwrapUser);
    }

    @Test
    void unwrapUser_endOfPartialInput_throws() {
        var arg = Arg.endOfPartialInput();

        assertTrue(arg.isBoundary());
        assertThrows(IllegalStateException.class, arg::unwrapUser);
    }

    @Test
    void user_nullText_rejected() {
        assertThrows(NullPointerException.class, () -> Arg.user(null));
    }

    @Test
    void sequence_completeInput_endsWithEndOfInput() {
        var args = Arg.sequence(List.of("cp", "-r", "src"), false);

        assertThat(args).containsExactly(Arg.user("cp"), Arg.user("-r"), Arg.user("src"), Arg.endOfInput());
    }

    @Test
    void sequence_partialInput_endsWithEndOfPartialInput() {
        var args = Arg.sequence(List.of("cp"), true);

        assertThat(args).containsExactly(Arg.user("cp"), Arg.endOfPartialInput());
    }

    @Test
    void sequence_emptyArgv_holdsOnlySentinel() {
        assertThat(Arg.sequence(List.of(), false)).containsExactly(Arg.endOfInput());
    }
}
