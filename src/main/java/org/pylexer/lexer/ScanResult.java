package org.pylexer.lexer;

/**
 * One item of the lexer output: either a token or an error, tagged with the line it
 * was detected on. Exactly one of {@code token} and {@code error} is non-null.
 *
 * @param line  The 1-based source line, or 0 for the dedents synthesized at end of input.
 * @param token The token, if scanning succeeded.
 * @param error The error, if scanning failed.
 */
public record ScanResult(int line, Token token, LexerError error) {

    public ScanResult {
        if ((token == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of token and error must be set");
        }
    }

    public static ScanResult ok(int line, Token token) {
        return new ScanResult(line, token, null);
    }

    public static ScanResult ok(int line, TokenType type) {
        return new ScanResult(line, Token.of(type), null);
    }

    public static ScanResult error(int line, LexerError error) {
        return new ScanResult(line, null, error);
    }

    public static ScanResult error(int line, LexerErrorKind kind) {
        return new ScanResult(line, null, LexerError.of(kind));
    }

    public boolean isOk() {
        return token != null;
    }

    public boolean isError() {
        return error != null;
    }

    /**
     * @param type The type to test against.
     * @return {@code true} if this is a successful result holding a token of the given type.
     */
    public boolean is(TokenType type) {
        return token != null && token.type() == type;
    }

    @Override
    public String toString() {
        return line + ":" + (token != null ? token : "ERR " + error);
    }
}
