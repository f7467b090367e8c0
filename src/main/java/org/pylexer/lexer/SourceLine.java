package org.pylexer.lexer;

/**
 * A cursor over one physical source line. The leading whitespace is measured and
 * consumed on construction; the cursor then walks the remaining code points.
 * <p>
 * Instances are owned by a single scanner and discarded once fully scanned.
 */
final class SourceLine {

    /** Value returned by the peek methods past the end of the line. */
    static final int EOL = -1;

    private static final int TAB_STOP_SIZE = 8;

    private final int number;
    private final int[] chars;
    private final int indentation;
    private final String leadingWhitespace;
    private int current;

    SourceLine(int number, String text) {
        this.number = number;
        this.chars = text.codePoints().toArray();

        int width = 0;
        int i = 0;
        while (i < chars.length && isSpace(chars[i])) {
            width = chars[i] == '\t' ? width + (TAB_STOP_SIZE - width % TAB_STOP_SIZE) : width + 1;
            i++;
        }
        this.indentation = width;
        this.leadingWhitespace = new String(chars, 0, i);
        this.current = i;
    }

    /**
     * Inter-token whitespace. Carriage return is treated as ordinary whitespace
     * rather than as a line terminator.
     */
    static boolean isSpace(int c) {
        return c == ' ' || c == '\t' || c == '\f' || c == '\r';
    }

    int number() {
        return number;
    }

    /**
     * @return The width of the leading whitespace, with tabs expanded to multiples of 8.
     */
    int indentation() {
        return indentation;
    }

    /**
     * @return The leading whitespace exactly as it appears in the source.
     */
    String leadingWhitespace() {
        return leadingWhitespace;
    }

    boolean isAtEnd() {
        return current >= chars.length;
    }

    int peek() {
        return peekAt(0);
    }

    int peekAt(int offset) {
        int index = current + offset;
        return index < chars.length ? chars[index] : EOL;
    }

    /**
     * Consumes one code point.
     * @return The consumed code point, or {@link #EOL} if the line is exhausted.
     */
    int advance() {
        if (isAtEnd()) {
            return EOL;
        }
        return chars[current++];
    }

    /**
     * Consumes the next code point if it equals the given one.
     */
    boolean match(int c) {
        if (peek() != c) {
            return false;
        }
        current++;
        return true;
    }

    void skipSpaces() {
        while (current < chars.length && isSpace(chars[current])) {
            current++;
        }
    }

    /**
     * @return {@code true} if nothing but a comment or nothing at all remains on the line.
     */
    boolean isLogicallyBlank() {
        return isAtEnd() || peek() == '#';
    }

    @Override
    public String toString() {
        return "SourceLine[" + number + ", indent=" + indentation + ", at=" + current + "]";
    }
}
