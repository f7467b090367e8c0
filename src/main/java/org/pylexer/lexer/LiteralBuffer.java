package org.pylexer.lexer;

import java.io.ByteArrayOutputStream;

/**
 * Accumulates the decoded content of a string or byte-string literal. The byte variant
 * narrows every appended code point to its low eight bits.
 */
abstract class LiteralBuffer {

    abstract void append(int codePoint);

    abstract boolean isBytes();

    abstract Token toToken();

    void append(String text) {
        text.codePoints().forEach(this::append);
    }

    static LiteralBuffer forText() {
        return new Text();
    }

    static LiteralBuffer forBytes() {
        return new Bytes();
    }

    private static final class Text extends LiteralBuffer {
        private final StringBuilder content = new StringBuilder();

        @Override
        void append(int codePoint) {
            content.appendCodePoint(codePoint);
        }

        @Override
        boolean isBytes() {
            return false;
        }

        @Override
        Token toToken() {
            return Token.string(content.toString());
        }
    }

    private static final class Bytes extends LiteralBuffer {
        private final ByteArrayOutputStream content = new ByteArrayOutputStream();

        @Override
        void append(int codePoint) {
            content.write((byte) codePoint);
        }

        @Override
        boolean isBytes() {
            return true;
        }

        @Override
        Token toToken() {
            return Token.bytes(content.toByteArray());
        }
    }
}
