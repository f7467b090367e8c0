package org.pylexer.lexer;

/**
 * Splits a text buffer into physical lines on demand.
 * <p>
 * Lines end at {@code \n}; a {@code \r} immediately before the {@code \n} belongs to
 * the terminator. A terminator at the very end of the buffer does not start an extra
 * empty line, so {@code "a\n"} and {@code "a"} both hold exactly one line.
 */
final class SourceLines {

    private final String source;
    private int position = 0;
    private int lineNumber = 0;

    SourceLines(String source) {
        this.source = source;
    }

    /**
     * @return The next physical line, or {@code null} if the buffer is exhausted.
     */
    SourceLine next() {
        if (position >= source.length()) {
            return null;
        }
        int end = source.indexOf('\n', position);
        String text;
        if (end < 0) {
            text = source.substring(position);
            position = source.length();
        } else {
            int contentEnd = end > position && source.charAt(end - 1) == '\r' ? end - 1 : end;
            text = source.substring(position, contentEnd);
            position = end + 1;
        }
        lineNumber++;
        return new SourceLine(lineNumber, text);
    }

    /**
     * @return The number of the last line handed out, 0 before the first call.
     */
    int lastLineNumber() {
        return lineNumber;
    }
}
