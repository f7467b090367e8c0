package org.pylexer.lexer;

import java.util.Objects;

/**
 * An error yielded by the {@link Lexer} in place of a token.
 *
 * @param kind   The kind of error.
 * @param detail Minimal context: the offending character, the unknown unicode name or
 *               an internal message. {@code null} when the kind needs no context.
 */
public record LexerError(LexerErrorKind kind, String detail) {

    public LexerError {
        Objects.requireNonNull(kind, "kind");
    }

    public static LexerError of(LexerErrorKind kind) {
        return new LexerError(kind, null);
    }

    public static LexerError invalidSymbol(int codePoint) {
        return new LexerError(LexerErrorKind.INVALID_SYMBOL, Character.toString(codePoint));
    }

    public static LexerError invalidCharacter(int codePoint) {
        return new LexerError(LexerErrorKind.INVALID_CHARACTER, Character.toString(codePoint));
    }

    public static LexerError unknownUnicodeName(String name) {
        return new LexerError(LexerErrorKind.UNKNOWN_UNICODE_NAME, name);
    }

    public static LexerError internal(String message) {
        return new LexerError(LexerErrorKind.INTERNAL, message);
    }

    /**
     * @return The error rendered as a diagnostic message, e.g. {@code invalid symbol '$'}.
     */
    public String message() {
        if (detail == null) {
            return kind.description();
        }
        return kind.description() + " '" + detail + "'";
    }

    @Override
    public String toString() {
        return detail == null ? kind.name() : kind.name() + "(" + detail + ")";
    }
}
