package org.pylexer.lexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scans string and byte-string literals, including their prefixes, triple quoting,
 * escape decoding and continuation across physical lines.
 * <p>
 * Because a literal may span lines, scanning returns the line the caller should resume
 * on, which is {@code null} once the input has been consumed.
 */
final class StringLiteralScanner {

    private static final Logger LOGGER = LoggerFactory.getLogger(StringLiteralScanner.class);

    /**
     * The result of scanning one literal.
     *
     * @param result     The literal token, or the error that ended the scan.
     * @param resumeLine The line to continue scanning on, or {@code null} if no input remains.
     */
    record Scanned(ScanResult result, SourceLine resumeLine) {}

    private final SourceLines lines;

    StringLiteralScanner(SourceLines lines) {
        this.lines = lines;
    }

    /**
     * Checks whether the cursor sits on a literal, optionally prefixed by
     * {@code u}, {@code r}, {@code b}, {@code rb} or {@code br} in any case.
     */
    static boolean startsLiteral(SourceLine line) {
        int c = line.peek();
        if (isQuote(c)) {
            return true;
        }
        int next = line.peekAt(1);
        if (c == 'u' || c == 'U') {
            return isQuote(next);
        }
        if (c == 'r' || c == 'R') {
            return isQuote(next) || ((next == 'b' || next == 'B') && isQuote(line.peekAt(2)));
        }
        if (c == 'b' || c == 'B') {
            return isQuote(next) || ((next == 'r' || next == 'R') && isQuote(line.peekAt(2)));
        }
        return false;
    }

    /**
     * Scans the literal at the cursor. {@link #startsLiteral(SourceLine)} must hold.
     */
    Scanned scan(SourceLine line) {
        boolean raw = false;
        boolean bytes = false;
        while (!isQuote(line.peek())) {
            int prefix = line.advance();
            switch (prefix) {
                case 'r', 'R' -> raw = true;
                case 'b', 'B' -> bytes = true;
                case 'u', 'U' -> { } // no effect on decoding
                default -> {
                    return new Scanned(ScanResult.error(line.number(),
                            LexerError.internal("unexpected literal prefix")), line);
                }
            }
        }

        int quote = line.advance();
        boolean triple = line.peek() == quote && line.peekAt(1) == quote;
        if (triple) {
            line.advance();
            line.advance();
        }
        LiteralBuffer content = bytes ? LiteralBuffer.forBytes() : LiteralBuffer.forText();
        return scanBody(line, quote, raw, triple, content);
    }

    private Scanned scanBody(SourceLine line, int quote, boolean raw, boolean triple, LiteralBuffer content) {
        int firstLine = line.number();
        SourceLine current = line;

        while (true) {
            int c = current.advance();

            if (c == SourceLine.EOL) {
                if (!triple) {
                    return new Scanned(ScanResult.error(current.number(), LexerErrorKind.UNTERMINATED_STRING), current);
                }
                content.append('\n');
                SourceLine next = lines.next();
                if (next == null) {
                    return unterminatedAtEnd(current, true);
                }
                content.append(next.leadingWhitespace());
                current = next;
            } else if (c == '\\') {
                int escaped = current.advance();
                if (escaped == SourceLine.EOL) {
                    if (raw) {
                        content.append('\\');
                        content.append('\n');
                    }
                    SourceLine next = lines.next();
                    if (next == null) {
                        return unterminatedAtEnd(current, triple);
                    }
                    content.append(next.leadingWhitespace());
                    current = next;
                } else if (raw) {
                    if (content.isBytes() && escaped > 0x7F) {
                        return new Scanned(ScanResult.error(current.number(), LexerError.invalidCharacter(escaped)), current);
                    }
                    content.append('\\');
                    content.append(escaped);
                } else {
                    LexerError error = EscapeDecoder.decode(escaped, current, content);
                    if (error != null) {
                        LOGGER.debug("Line {}: {}", current.number(), error.message());
                        return new Scanned(ScanResult.error(current.number(), error), current);
                    }
                }
            } else if (c == quote) {
                if (!triple) {
                    break;
                }
                if (current.peek() == quote && current.peekAt(1) == quote) {
                    current.advance();
                    current.advance();
                    break;
                }
                content.append(c);
            } else {
                content.append(c);
            }
        }

        return new Scanned(ScanResult.ok(firstLine, content.toToken()), current);
    }

    /**
     * Input ran out inside a literal. The error is reported on the line after the last one consumed.
     */
    private Scanned unterminatedAtEnd(SourceLine last, boolean triple) {
        LexerErrorKind kind = triple ? LexerErrorKind.UNTERMINATED_TRIPLE_STRING : LexerErrorKind.UNTERMINATED_STRING;
        LOGGER.debug("Input ended inside a literal after line {}", last.number());
        return new Scanned(ScanResult.error(last.number() + 1, kind), null);
    }

    private static boolean isQuote(int c) {
        return c == '\'' || c == '"';
    }
}
