package org.pylexer.lexer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pylexer.lexer.LexerErrorKind.INVALID_CHARACTER;
import static org.pylexer.lexer.TokenFixtures.bytes;
import static org.pylexer.lexer.TokenFixtures.err;
import static org.pylexer.lexer.TokenFixtures.ok;
import static org.pylexer.lexer.TokenFixtures.str;

/**
 * Contains unit tests for byte-string literals.
 */
@Tag("unit")
class ByteLiteralTest {

    @Test
    void tripleQuotedBytes() {
        assertThat(Lexer.tokenize("b'''hello'''").get(0)).isEqualTo(bytes(1, 104, 101, 108, 108, 111));
        assertThat(Lexer.tokenize("b'''hello\nblah'''").get(0))
                .isEqualTo(bytes(1, 104, 101, 108, 108, 111, 10, 98, 108, 97, 104));
    }

    @Test
    void octalAndHexEscapesNarrowToOneByte() {
        assertThat(Lexer.tokenize("b'\\x26\\040'").get(0)).isEqualTo(bytes(1, 38, 32));
        assertThat(Lexer.tokenize("b'\\x26\\040\\700\\300'").get(0)).isEqualTo(bytes(1, 38, 32, 192, 192));
    }

    @Test
    void escapedLineEndKeepsTheNextLinesLeadingWhitespace() {
        assertThat(Lexer.tokenize("b'abc\\\n  \t 123'")).containsExactly(
                bytes(1, 97, 98, 99, 32, 32, 9, 32, 49, 50, 51),
                ok(2, TokenType.NEWLINE));
    }

    @Test
    void adjacentBytesJoinAcrossAnExplicitLineJoin() {
        assertThat(Lexer.tokenize("b'abc\\\n  \t 123' \\\n  b'123'").get(0))
                .isEqualTo(bytes(1, 97, 98, 99, 32, 32, 9, 32, 49, 50, 51, 49, 50, 51));
    }

    @Test
    void rawBytesKeepEscapesAndEscapedLineEnds() {
        assertThat(Lexer.tokenize("rb'abc\\' \\\n  \t 123'").get(0))
                .isEqualTo(bytes(1, 97, 98, 99, 92, 39, 32, 92, 10, 32, 32, 9, 32, 49, 50, 51));
        assertThat(Lexer.tokenize("Br'abc\\' \\\n  \t' bR' 123'").get(0))
                .isEqualTo(bytes(1, 97, 98, 99, 92, 39, 32, 92, 10, 32, 32, 9, 32, 49, 50, 51));
    }

    @Test
    void unicodeEscapesAreInvalidInBytes() {
        assertThat(Lexer.tokenize("b'\\N{BLACK STAR}'").get(0)).isEqualTo(err(1, INVALID_CHARACTER, "N"));
        assertThat(Lexer.tokenize("b'\\u1234'").get(0)).isEqualTo(err(1, INVALID_CHARACTER, "u"));
        assertThat(Lexer.tokenize("B'\\U00001234'").get(0)).isEqualTo(err(1, INVALID_CHARACTER, "U"));
        assertThat(Lexer.tokenize("b'\\é'").get(0)).isEqualTo(err(1, INVALID_CHARACTER, "é"));
        assertThat(Lexer.tokenize("rb'\\é'").get(0)).isEqualTo(err(1, INVALID_CHARACTER, "é"));
    }

    @Test
    void unknownAsciiEscapeKeepsTheBackslash() {
        assertThat(Lexer.tokenize("b'\\q'").get(0)).isEqualTo(bytes(1, 92, 113));
    }

    @Test
    void bytesAndStringsNeverMerge() {
        assertThat(Lexer.tokenize("'a' b'b' 'c'\n")).containsExactly(
                str(1, "a"),
                bytes(1, 98),
                str(1, "c"),
                ok(1, TokenType.NEWLINE));
    }
}
