package org.pylexer.lexer;

/**
 * Scans numeric literals: radix-prefixed integers, decimal integers, point and
 * exponent floats, and imaginary numbers. Lexemes keep their exact source text.
 * <p>
 * A literal is built in stages; each stage receives the result of the previous one and
 * either extends it, passes it through unchanged, or turns it into an error.
 */
final class NumberScanner {

    /**
     * A partially scanned number: either a typed lexeme or an error kind.
     */
    private record Partial(TokenType type, String lexeme, LexerErrorKind error) {

        static Partial of(TokenType type, String lexeme) {
            return new Partial(type, lexeme, null);
        }

        static Partial failed(LexerErrorKind error) {
            return new Partial(null, null, error);
        }

        boolean isError() {
            return error != null;
        }

        boolean isDecimalOrFloat() {
            return type == TokenType.DEC_INTEGER || type == TokenType.FLOAT;
        }
    }

    private NumberScanner() {}

    /**
     * Scans the number at the cursor, which sits on a digit or on a dot followed by a digit.
     */
    static ScanResult scan(SourceLine line) {
        int lineNumber = line.number();
        Partial result;
        if (line.peek() == '0') {
            result = zeroPrefixed(line);
        } else if (line.peek() == '.') {
            result = dotPrefixed(line);
        } else {
            result = floatPart(requireDigits("", line, 10, TokenType.DEC_INTEGER), line);
        }

        if (result.isError()) {
            return ScanResult.error(lineNumber, result.error());
        }
        return ScanResult.ok(lineNumber, Token.of(result.type(), result.lexeme()));
    }

    private static Partial zeroPrefixed(SourceLine line) {
        StringBuilder lexeme = new StringBuilder();
        lexeme.appendCodePoint(line.advance());

        int c = line.peek();
        switch (c) {
            case 'o', 'O' -> {
                lexeme.appendCodePoint(line.advance());
                return requireDigits(lexeme.toString(), line, 8, TokenType.OCT_INTEGER);
            }
            case 'x', 'X' -> {
                lexeme.appendCodePoint(line.advance());
                return requireDigits(lexeme.toString(), line, 16, TokenType.HEX_INTEGER);
            }
            case 'b', 'B' -> {
                lexeme.appendCodePoint(line.advance());
                return requireDigits(lexeme.toString(), line, 2, TokenType.BIN_INTEGER);
            }
            default -> {
                while (line.peek() == '0') {
                    lexeme.appendCodePoint(line.advance());
                }
                if (isDigit(line.peek(), 10)) {
                    // a non-zero decimal with leading zeros is only legal as a float or imaginary
                    Partial digits = requireDigits(lexeme.toString(), line, 10, TokenType.DEC_INTEGER);
                    return requireFloatPart(digits, line);
                }
                return floatPart(Partial.of(TokenType.DEC_INTEGER, lexeme.toString()), line);
            }
        }
    }

    private static Partial dotPrefixed(SourceLine line) {
        String lexeme = Character.toString(line.advance());
        if (!isDigit(line.peek(), 10)) {
            return Partial.failed(LexerErrorKind.INTERNAL);
        }
        Partial result = requireDigits(lexeme, line, 10, TokenType.FLOAT);
        result = exponentFloat(result, line);
        return imaginary(result, line);
    }

    private static Partial requireFloatPart(Partial token, SourceLine line) {
        int c = line.peek();
        if (c != '.' && c != 'e' && c != 'E' && c != 'j' && c != 'J') {
            return Partial.failed(LexerErrorKind.MALFORMED_FLOAT);
        }
        return floatPart(token, line);
    }

    private static Partial floatPart(Partial token, SourceLine line) {
        Partial result = pointFloat(token, line);
        result = exponentFloat(result, line);
        return imaginary(result, line);
    }

    private static Partial pointFloat(Partial token, SourceLine line) {
        if (token.isError() || line.peek() != '.') {
            return token;
        }
        if (token.type() != TokenType.DEC_INTEGER) {
            return Partial.failed(LexerErrorKind.MALFORMED_FLOAT);
        }
        String lexeme = token.lexeme() + Character.toString(line.advance());
        if (isDigit(line.peek(), 10)) {
            return requireDigits(lexeme, line, 10, TokenType.FLOAT);
        }
        return Partial.of(TokenType.FLOAT, lexeme);
    }

    private static Partial exponentFloat(Partial token, SourceLine line) {
        if (token.isError() || (line.peek() != 'e' && line.peek() != 'E')) {
            return token;
        }
        if (!token.isDecimalOrFloat()) {
            return Partial.failed(LexerErrorKind.MALFORMED_FLOAT);
        }
        StringBuilder lexeme = new StringBuilder(token.lexeme());
        lexeme.appendCodePoint(line.advance());
        if (line.peek() == '+' || line.peek() == '-') {
            lexeme.appendCodePoint(line.advance());
        }
        return requireDigits(lexeme.toString(), line, 10, TokenType.FLOAT);
    }

    private static Partial imaginary(Partial token, SourceLine line) {
        if (token.isError() || (line.peek() != 'j' && line.peek() != 'J')) {
            return token;
        }
        if (!token.isDecimalOrFloat()) {
            return Partial.failed(LexerErrorKind.MALFORMED_IMAGINARY);
        }
        return Partial.of(TokenType.IMAGINARY, token.lexeme() + Character.toString(line.advance()));
    }

    private static Partial requireDigits(String prefix, SourceLine line, int radix, TokenType type) {
        if (!isDigit(line.peek(), radix)) {
            return Partial.failed(LexerErrorKind.MISSING_DIGITS);
        }
        StringBuilder lexeme = new StringBuilder(prefix);
        while (isDigit(line.peek(), radix)) {
            lexeme.appendCodePoint(line.advance());
        }
        return Partial.of(type, lexeme.toString());
    }

    /**
     * ASCII-only digit test for the given radix.
     */
    static boolean isDigit(int c, int radix) {
        int value;
        if (c >= '0' && c <= '9') {
            value = c - '0';
        } else if (c >= 'a' && c <= 'z') {
            value = c - 'a' + 10;
        } else if (c >= 'A' && c <= 'Z') {
            value = c - 'A' + 10;
        } else {
            return false;
        }
        return value < radix;
    }
}
