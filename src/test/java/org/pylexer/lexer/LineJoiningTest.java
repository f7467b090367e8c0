package org.pylexer.lexer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pylexer.lexer.TokenFixtures.dec;
import static org.pylexer.lexer.TokenFixtures.ident;
import static org.pylexer.lexer.TokenFixtures.ok;
import static org.pylexer.lexer.TokenFixtures.str;

/**
 * Contains unit tests for implicit line joining inside brackets.
 */
@Tag("unit")
class LineJoiningTest {

    @Test
    void parenthesesJoinLines() {
        assertThat(Lexer.tokenize("(1 + \n      2 \n)")).containsExactly(
                ok(1, TokenType.LPAREN),
                dec(1, "1"),
                ok(1, TokenType.PLUS),
                dec(2, "2"),
                ok(3, TokenType.RPAREN),
                ok(3, TokenType.NEWLINE));
    }

    @Test
    void nestedBracketsSuspendIndentationUntilClosed() {
        assertThat(Lexer.tokenize("   (1 + \n   (   2 \n + 9 \n ) * \n      2 \n )\n2")).containsExactly(
                ok(1, TokenType.INDENT),
                ok(1, TokenType.LPAREN),
                dec(1, "1"),
                ok(1, TokenType.PLUS),
                ok(2, TokenType.LPAREN),
                dec(2, "2"),
                ok(3, TokenType.PLUS),
                dec(3, "9"),
                ok(4, TokenType.RPAREN),
                ok(4, TokenType.TIMES),
                dec(5, "2"),
                ok(6, TokenType.RPAREN),
                ok(6, TokenType.NEWLINE),
                ok(7, TokenType.DEDENT),
                dec(7, "2"),
                ok(7, TokenType.NEWLINE));
    }

    @Test
    void stringsJoinAcrossBracketedLines() {
        assertThat(Lexer.tokenize("('abc' \n      'def' \n)")).containsExactly(
                ok(1, TokenType.LPAREN),
                str(1, "abcdef"),
                ok(3, TokenType.RPAREN),
                ok(3, TokenType.NEWLINE));
    }

    @Test
    void functionHeaderSpanningLines() {
        assertThat(Lexer.tokenize("def abc(a, g,\n         c):\n   first")).containsExactly(
                ok(1, TokenType.DEF),
                ident(1, "abc"),
                ok(1, TokenType.LPAREN),
                ident(1, "a"),
                ok(1, TokenType.COMMA),
                ident(1, "g"),
                ok(1, TokenType.COMMA),
                ident(2, "c"),
                ok(2, TokenType.RPAREN),
                ok(2, TokenType.COLON),
                ok(2, TokenType.NEWLINE),
                ok(3, TokenType.INDENT),
                ident(3, "first"),
                ok(3, TokenType.NEWLINE),
                ok(0, TokenType.DEDENT));
    }

    @Test
    void commentLineInsideBracketsIsSkipped() {
        assertThat(Lexer.tokenize("('abc'\n   #  'def' \n)")).containsExactly(
                ok(1, TokenType.LPAREN),
                str(1, "abc"),
                ok(3, TokenType.RPAREN),
                ok(3, TokenType.NEWLINE));
    }

    @Test
    void commentLineOutsideBracketsEndsNothing() {
        assertThat(Lexer.tokenize("'abc'\n   #  'def' \n123\n")).containsExactly(
                str(1, "abc"),
                ok(1, TokenType.NEWLINE),
                dec(3, "123"),
                ok(3, TokenType.NEWLINE));
    }

    @Test
    void unbalancedClosingBracketDoesNotUnderflow() {
        assertThat(Lexer.tokenize(") (\n1)\nx\n")).containsExactly(
                ok(1, TokenType.RPAREN),
                ok(1, TokenType.LPAREN),
                dec(2, "1"),
                ok(2, TokenType.RPAREN),
                ok(2, TokenType.NEWLINE),
                ident(3, "x"),
                ok(3, TokenType.NEWLINE));
    }

    @Test
    void bracketDepthIsTrackedByTheCoreScanner() {
        CoreScanner scanner = new CoreScanner("([{\n");

        scanner.pull();
        scanner.pull();
        scanner.pull();

        assertThat(scanner.bracketDepth()).isEqualTo(3);
        assertThat(scanner.pull()).isNull();
    }
}
