package org.pylexer.lexer;

import java.util.Map;

/**
 * Decodes backslash escape sequences inside non-raw literals.
 * <p>
 * The backslash and the escaped character have already been consumed; any further
 * characters an escape needs (octal digits, hex digits, a braced name) are read from
 * the line. Escapes that end a physical line are handled by the {@link StringLiteralScanner}.
 */
final class EscapeDecoder {

    private static final Map<Integer, Integer> SIMPLE_ESCAPES = Map.of(
            (int) '\\', (int) '\\',
            (int) '\'', (int) '\'',
            (int) '"', (int) '"',
            (int) 'a', 0x07,
            (int) 'b', 0x08,
            (int) 'f', 0x0C,
            (int) 'n', (int) '\n',
            (int) 'r', (int) '\r',
            (int) 't', (int) '\t',
            (int) 'v', 0x0B
    );

    private EscapeDecoder() {}

    /**
     * Decodes one escape sequence into the buffer.
     *
     * @param escaped The character following the backslash.
     * @param line    The line, positioned right after {@code escaped}.
     * @param out     The literal content being built.
     * @return {@code null} on success, otherwise the error to report.
     */
    static LexerError decode(int escaped, SourceLine line, LiteralBuffer out) {
        Integer simple = SIMPLE_ESCAPES.get(escaped);
        if (simple != null) {
            out.append(simple);
            return null;
        }
        if (isOctalDigit(escaped)) {
            int value = escaped - '0';
            for (int i = 0; i < 2 && isOctalDigit(line.peek()); i++) {
                value = value * 8 + (line.advance() - '0');
            }
            out.append(value);
            return null;
        }
        if (escaped == 'x') {
            int value = readHex(line, 2);
            if (value < 0) {
                return LexerError.of(LexerErrorKind.HEX_ESCAPE_SHORT);
            }
            out.append(value);
            return null;
        }
        if (out.isBytes()) {
            if (escaped == 'N' || escaped == 'u' || escaped == 'U' || escaped > 0x7F) {
                return LexerError.invalidCharacter(escaped);
            }
            out.append('\\');
            out.append(escaped);
            return null;
        }
        return switch (escaped) {
            case 'N' -> decodeNamed(line, out);
            case 'u' -> decodeUnicode(line, out, 4);
            case 'U' -> decodeUnicode(line, out, 8);
            default -> {
                // unrecognized escapes are kept as written
                out.append('\\');
                out.append(escaped);
                yield null;
            }
        };
    }

    private static LexerError decodeUnicode(SourceLine line, LiteralBuffer out, int digits) {
        int value = readHex(line, digits);
        if (value < 0 || !Character.isValidCodePoint(value)) {
            return LexerError.of(LexerErrorKind.MALFORMED_UNICODE_ESCAPE);
        }
        out.append(value);
        return null;
    }

    private static LexerError decodeNamed(SourceLine line, LiteralBuffer out) {
        if (!line.match('{')) {
            return LexerError.of(LexerErrorKind.MALFORMED_NAMED_UNICODE_ESCAPE);
        }
        StringBuilder name = new StringBuilder();
        while (!line.isAtEnd() && line.peek() != '}') {
            name.appendCodePoint(line.advance());
        }
        if (!line.match('}')) {
            return LexerError.of(LexerErrorKind.MALFORMED_NAMED_UNICODE_ESCAPE);
        }
        try {
            out.append(Character.codePointOf(name.toString()));
            return null;
        } catch (IllegalArgumentException e) {
            return LexerError.unknownUnicodeName(name.toString());
        }
    }

    /**
     * Reads exactly {@code digits} hex digits. Digits read before a shortfall stay consumed.
     * @return The value, or -1 if fewer digits were present or the value overflows.
     */
    private static int readHex(SourceLine line, int digits) {
        long value = 0;
        for (int i = 0; i < digits; i++) {
            int digit = Character.digit(line.peek(), 16);
            if (line.peek() > 0x7F || digit < 0) {
                return -1;
            }
            line.advance();
            value = value * 16 + digit;
        }
        return value > Integer.MAX_VALUE ? -1 : (int) value;
    }

    private static boolean isOctalDigit(int c) {
        return c >= '0' && c <= '7';
    }
}
