package org.pylexer.lexer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pylexer.lexer.TokenFixtures.bytes;
import static org.pylexer.lexer.TokenFixtures.err;
import static org.pylexer.lexer.TokenFixtures.ok;
import static org.pylexer.lexer.TokenFixtures.str;

/**
 * Contains unit tests for the stages joining adjacent string and byte literals.
 */
@Tag("unit")
class LiteralJoiningStreamTest {

    /**
     * Replays a fixed list of items and counts how often it is pulled.
     */
    private static final class ScriptedStream implements ITokenStream {
        private final Deque<ScanResult> items;
        private int pulls = 0;

        ScriptedStream(ScanResult... items) {
            this.items = new ArrayDeque<>(Arrays.asList(items));
        }

        @Override
        public ScanResult pull() {
            pulls++;
            return items.poll();
        }
    }

    private static List<ScanResult> drain(ITokenStream stream) {
        List<ScanResult> results = new ArrayList<>();
        for (ScanResult r = stream.pull(); r != null; r = stream.pull()) {
            results.add(r);
        }
        return results;
    }

    @Test
    void runOfStringsMergesWithTheFirstLine() {
        ScriptedStream inner = new ScriptedStream(
                str(2, "a"), str(3, "b"), str(5, "c"), ok(5, TokenType.NEWLINE));

        assertThat(drain(new StringJoiningStream(inner))).containsExactly(
                str(2, "abc"),
                ok(5, TokenType.NEWLINE));
    }

    @Test
    void errorsEndARunAndPassThrough() {
        ScriptedStream inner = new ScriptedStream(
                str(1, "a"), err(1, LexerErrorKind.HEX_ESCAPE_SHORT), str(1, "b"), str(1, "c"));

        assertThat(drain(new StringJoiningStream(inner))).containsExactly(
                str(1, "a"),
                err(1, LexerErrorKind.HEX_ESCAPE_SHORT),
                str(1, "bc"));
    }

    @Test
    void bytesStageLeavesStringsAlone() {
        ScriptedStream inner = new ScriptedStream(
                bytes(1, 1), bytes(1, 2, 3), str(1, "x"), str(1, "y"), bytes(2, 4));

        assertThat(drain(new BytesJoiningStream(inner))).containsExactly(
                bytes(1, 1, 2, 3),
                str(1, "x"),
                str(1, "y"),
                bytes(2, 4));
    }

    @Test
    void chainedStagesJoinEachKindSeparately() {
        ScriptedStream inner = new ScriptedStream(
                bytes(1, 1), bytes(1, 2), str(1, "x"), str(2, "y"), ok(2, TokenType.NEWLINE));

        assertThat(drain(new StringJoiningStream(new BytesJoiningStream(inner)))).containsExactly(
                bytes(1, 1, 2),
                str(1, "xy"),
                ok(2, TokenType.NEWLINE));
    }

    @Test
    void pullsOnlyWhatItNeeds() {
        ScriptedStream inner = new ScriptedStream(
                ok(1, TokenType.DOT), str(1, "a"), ok(1, TokenType.COMMA), ok(1, TokenType.NEWLINE));
        StringJoiningStream stream = new StringJoiningStream(inner);

        assertThat(stream.pull()).isEqualTo(ok(1, TokenType.DOT));
        assertThat(inner.pulls).isEqualTo(1);
        assertThat(stream.pull()).isEqualTo(str(1, "a"));
        assertThat(inner.pulls).isEqualTo(3);
        assertThat(stream.pull()).isEqualTo(ok(1, TokenType.COMMA));
        assertThat(inner.pulls).isEqualTo(3);
    }

    @Test
    void exhaustedInnerStreamStaysExhausted() {
        StringJoiningStream stream = new StringJoiningStream(new ScriptedStream(str(1, "a")));

        assertThat(stream.pull()).isEqualTo(str(1, "a"));
        assertThat(stream.pull()).isNull();
        assertThat(stream.pull()).isNull();
    }
}
