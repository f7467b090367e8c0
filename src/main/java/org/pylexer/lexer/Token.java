package org.pylexer.lexer;

import java.util.Arrays;
import java.util.Objects;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 * <p>
 * Numeric and identifier tokens keep their exact source lexeme in {@code text};
 * string tokens hold the decoded content; byte-string tokens hold the decoded
 * bytes in {@code bytes}. Keywords, operators and layout markers carry no payload.
 *
 * @param type  The type of the token.
 * @param text  The textual payload, or {@code null} for types without one.
 * @param bytes The decoded content of a byte-string literal, or {@code null}.
 */
public record Token(TokenType type, String text, byte[] bytes) {

    public Token {
        Objects.requireNonNull(type, "type");
        if (type == TokenType.BYTES) {
            Objects.requireNonNull(bytes, "bytes");
            bytes = bytes.clone();
        } else if (type.hasText()) {
            Objects.requireNonNull(text, "text");
        }
    }

    /**
     * Creates a token without payload (keyword, operator or layout marker).
     * @param type The token type.
     * @return The token.
     */
    public static Token of(TokenType type) {
        if (type.hasText() || type == TokenType.BYTES) {
            throw new IllegalArgumentException("Token type " + type + " requires a payload");
        }
        return new Token(type, null, null);
    }

    /**
     * Creates a token that carries text: an identifier, a decoded string or a numeric lexeme.
     * @param type The token type.
     * @param text The payload.
     * @return The token.
     */
    public static Token of(TokenType type, String text) {
        if (!type.hasText()) {
            throw new IllegalArgumentException("Token type " + type + " carries no text");
        }
        return new Token(type, text, null);
    }

    public static Token identifier(String name) {
        return of(TokenType.IDENTIFIER, name);
    }

    public static Token string(String content) {
        return of(TokenType.STRING, content);
    }

    public static Token bytes(byte[] content) {
        return new Token(TokenType.BYTES, null, content);
    }

    @Override
    public byte[] bytes() {
        return bytes == null ? null : bytes.clone();
    }

    /**
     * Returns the exact source text for keywords, operators, identifiers and numbers.
     * Strings and byte strings return {@code null} because their content is decoded,
     * and layout markers return {@code null} because they are synthesized.
     *
     * @return The source lexeme or {@code null}.
     */
    public String sourceText() {
        if (type.lexeme() != null) {
            return type.lexeme();
        }
        if (type == TokenType.IDENTIFIER || type.category() == TokenType.Category.NUMBER) {
            return text;
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token other)) return false;
        return type == other.type && Objects.equals(text, other.text) && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(type, text) + Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        if (type == TokenType.BYTES) {
            return type + "(" + Arrays.toString(bytes) + ")";
        }
        if (text != null) {
            return type + "(" + text + ")";
        }
        return type.name();
    }

    /**
     * Renders the payload for display, escaping control characters. Bytes are rendered
     * as a Python-style byte literal body.
     *
     * @return A printable representation of the payload, or the canonical lexeme.
     */
    public String displayText() {
        if (type == TokenType.BYTES) {
            StringBuilder sb = new StringBuilder();
            for (byte b : bytes) {
                int v = b & 0xFF;
                if (v >= 0x20 && v < 0x7F && v != '\\') {
                    sb.append((char) v);
                } else {
                    sb.append(String.format("\\x%02x", v));
                }
            }
            return sb.toString();
        }
        if (text != null) {
            return escape(text);
        }
        return type.lexeme() != null ? type.lexeme() : "";
    }

    private static String escape(String s) {
        StringBuilder sb = new StringBuilder();
        s.codePoints().forEach(cp -> {
            switch (cp) {
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\\' -> sb.append("\\\\");
                default -> {
                    if (cp < 0x20 || cp == 0x7F) {
                        sb.append(String.format("\\x%02x", cp));
                    } else {
                        sb.appendCodePoint(cp);
                    }
                }
            }
        });
        return sb.toString();
    }
}
