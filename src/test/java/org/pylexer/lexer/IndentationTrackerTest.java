package org.pylexer.lexer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pylexer.lexer.LexerErrorKind.DEDENT;
import static org.pylexer.lexer.TokenFixtures.err;
import static org.pylexer.lexer.TokenFixtures.ident;
import static org.pylexer.lexer.TokenFixtures.ok;

/**
 * Contains unit tests for indentation tracking, both on the tracker directly and
 * through the full lexer.
 */
@Tag("unit")
class IndentationTrackerTest {

    @Nested
    @DisplayName("Tracker")
    class Tracker {

        @Test
        void deeperLinePushesALevel() {
            IndentationTracker tracker = new IndentationTracker();

            assertThat(tracker.evaluate(new SourceLine(1, "a"))).isEqualTo(IndentationTracker.LineStart.SAME);
            assertThat(tracker.evaluate(new SourceLine(2, "    b"))).isEqualTo(IndentationTracker.LineStart.INDENT);
            assertThat(tracker.depth()).isEqualTo(2);
            assertThat(tracker.hasPendingDedents()).isFalse();
        }

        @Test
        void blankAndCommentLinesLeaveTheStackAlone() {
            IndentationTracker tracker = new IndentationTracker();

            assertThat(tracker.evaluate(new SourceLine(1, "        "))).isEqualTo(IndentationTracker.LineStart.BLANK);
            assertThat(tracker.evaluate(new SourceLine(2, "      # note"))).isEqualTo(IndentationTracker.LineStart.BLANK);
            assertThat(tracker.depth()).isEqualTo(1);
        }

        @Test
        void balancedDedentDrainsPlainDedents() {
            IndentationTracker tracker = new IndentationTracker();
            tracker.evaluate(new SourceLine(1, "  a"));
            tracker.evaluate(new SourceLine(2, "    b"));

            assertThat(tracker.evaluate(new SourceLine(3, "c"))).isEqualTo(IndentationTracker.LineStart.DEDENT);
            assertThat(tracker.drainOne(3)).isEqualTo(ok(3, TokenType.DEDENT));
            assertThat(tracker.drainOne(3)).isEqualTo(ok(3, TokenType.DEDENT));
            assertThat(tracker.hasPendingDedents()).isFalse();
            assertThat(tracker.depth()).isEqualTo(1);
        }

        @Test
        void mismatchedDedentEndsWithExactlyOneError() {
            IndentationTracker tracker = new IndentationTracker();
            tracker.evaluate(new SourceLine(1, "    a"));
            tracker.evaluate(new SourceLine(2, "        b"));

            tracker.evaluate(new SourceLine(3, "  c"));

            assertThat(tracker.drainOne(3)).isEqualTo(ok(3, TokenType.DEDENT));
            assertThat(tracker.drainOne(3)).isEqualTo(err(3, DEDENT));
            assertThat(tracker.hasPendingDedents()).isFalse();
            assertThat(tracker.depth()).isEqualTo(1);
        }

        @Test
        void closesOneLevelPerCallAtEnd() {
            IndentationTracker tracker = new IndentationTracker();
            tracker.evaluate(new SourceLine(1, " a"));
            tracker.evaluate(new SourceLine(2, "  b"));

            assertThat(tracker.closeLevelAtEnd()).isTrue();
            assertThat(tracker.closeLevelAtEnd()).isTrue();
            assertThat(tracker.closeLevelAtEnd()).isFalse();
            assertThat(tracker.depth()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Lexer output")
    class LexerOutput {

        @Test
        void indentedSingleLineIsClosedAtEndWithLineZero() {
            assertThat(Lexer.tokenize("    x\n")).containsExactly(
                    ok(1, TokenType.INDENT),
                    ident(1, "x"),
                    ok(1, TokenType.NEWLINE),
                    ok(0, TokenType.DEDENT));
        }

        /**
         * Blank lines between blocks produce nothing; the two-level dedent lands between
         * levels and is reported after the ordinary dedents.
         */
        @Test
        void misalignedDedentAfterBlankLines() {
            String source = "    abf xyz\n\n\n\n        e2f\n             n12\n  n2\n";

            assertThat(Lexer.tokenize(source)).containsExactly(
                    ok(1, TokenType.INDENT),
                    ident(1, "abf"),
                    ident(1, "xyz"),
                    ok(1, TokenType.NEWLINE),
                    ok(5, TokenType.INDENT),
                    ident(5, "e2f"),
                    ok(5, TokenType.NEWLINE),
                    ok(6, TokenType.INDENT),
                    ident(6, "n12"),
                    ok(6, TokenType.NEWLINE),
                    ok(7, TokenType.DEDENT),
                    ok(7, TokenType.DEDENT),
                    err(7, DEDENT),
                    ident(7, "n2"),
                    ok(7, TokenType.NEWLINE));
        }

        @Test
        void tabAndEightSpacesAreTheSameLevel() {
            assertThat(Lexer.tokenize("if a:\n\tb\n        c\n")).containsExactly(
                    ok(1, TokenType.IF),
                    ident(1, "a"),
                    ok(1, TokenType.COLON),
                    ok(1, TokenType.NEWLINE),
                    ok(2, TokenType.INDENT),
                    ident(2, "b"),
                    ok(2, TokenType.NEWLINE),
                    ident(3, "c"),
                    ok(3, TokenType.NEWLINE),
                    ok(0, TokenType.DEDENT));
        }

        @Test
        void nestedBlocksAreAllClosedAtEnd() {
            assertThat(Lexer.tokenize("if x:\n  if y:\n    z\n"))
                    .filteredOn(r -> r.is(TokenType.DEDENT))
                    .containsExactly(ok(0, TokenType.DEDENT), ok(0, TokenType.DEDENT));
        }

        @Test
        void indentationInsideBracketsIsIgnored() {
            assertThat(Lexer.tokenize("f(a,\n        b)\nc\n")).containsExactly(
                    ident(1, "f"),
                    ok(1, TokenType.LPAREN),
                    ident(1, "a"),
                    ok(1, TokenType.COMMA),
                    ident(2, "b"),
                    ok(2, TokenType.RPAREN),
                    ok(2, TokenType.NEWLINE),
                    ident(3, "c"),
                    ok(3, TokenType.NEWLINE));
        }
    }
}
