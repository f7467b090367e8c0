package org.pylexer.lexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The innermost lexer stage. Pulls physical lines on demand, applies the indentation
 * tracker at line starts outside brackets, and classifies one lexeme per pull.
 * It is not thread-safe.
 */
final class CoreScanner implements ITokenStream {

    private static final Logger LOGGER = LoggerFactory.getLogger(CoreScanner.class);

    private final SourceLines lines;
    private final IndentationTracker indentation = new IndentationTracker();
    private final StringLiteralScanner literals;

    /** The line being scanned; {@code null} means the next line starts a new logical line. */
    private SourceLine currentLine;
    private int bracketDepth = 0;

    CoreScanner(String source) {
        this.lines = new SourceLines(source);
        this.literals = new StringLiteralScanner(lines);
    }

    @Override
    public ScanResult pull() {
        while (true) {
            if (currentLine == null) {
                SourceLine line = lines.next();
                if (line == null) {
                    return endOfInput();
                }
                IndentationTracker.LineStart start = indentation.evaluate(line);
                if (start == IndentationTracker.LineStart.BLANK) {
                    continue;
                }
                currentLine = line;
                if (start == IndentationTracker.LineStart.INDENT) {
                    return ScanResult.ok(line.number(), TokenType.INDENT);
                }
            }

            if (indentation.hasPendingDedents()) {
                return indentation.drainOne(currentLine.number());
            }

            currentLine.skipSpaces();
            int c = currentLine.peek();

            if (currentLine.isLogicallyBlank()) {
                if (bracketDepth == 0) {
                    int number = currentLine.number();
                    currentLine = null;
                    return ScanResult.ok(number, TokenType.NEWLINE);
                }
                // implicit line join
                currentLine = lines.next();
                continue;
            }
            if (StringLiteralScanner.startsLiteral(currentLine)) {
                StringLiteralScanner.Scanned scanned = literals.scan(currentLine);
                currentLine = scanned.resumeLine();
                return scanned.result();
            }
            if (isIdentifierStart(c)) {
                return identifier();
            }
            if (NumberScanner.isDigit(c, 10) || (c == '.' && NumberScanner.isDigit(currentLine.peekAt(1), 10))) {
                return NumberScanner.scan(currentLine);
            }
            if (c == '\\') {
                int number = currentLine.number();
                currentLine.advance();
                if (!currentLine.isAtEnd()) {
                    return ScanResult.error(number, LexerErrorKind.BAD_LINE_CONTINUATION);
                }
                // explicit line join
                currentLine = lines.next();
                continue;
            }
            return symbol();
        }
    }

    private ScanResult endOfInput() {
        if (indentation.closeLevelAtEnd()) {
            LOGGER.trace("Closing indentation level at end of input");
            return ScanResult.ok(0, TokenType.DEDENT);
        }
        return null;
    }

    private ScanResult identifier() {
        int number = currentLine.number();
        StringBuilder name = new StringBuilder();
        name.appendCodePoint(currentLine.advance());
        while (isIdentifierContinue(currentLine.peek())) {
            name.appendCodePoint(currentLine.advance());
        }
        return ScanResult.ok(number, Keywords.classify(name.toString()));
    }

    private ScanResult symbol() {
        ScanResult result = SymbolScanner.scan(currentLine);
        if (result.isOk()) {
            bracketDepth = Math.max(0, bracketDepth + SymbolScanner.nestingDelta(result.token().type()));
        } else {
            LOGGER.debug("Line {}: {}", result.line(), result.error().message());
        }
        return result;
    }

    /**
     * Simplified stand-in for XID_Start: any alphabetic character or underscore.
     */
    static boolean isIdentifierStart(int c) {
        return c == '_' || (c != SourceLine.EOL && Character.isAlphabetic(c));
    }

    /**
     * Simplified stand-in for XID_Continue: any alphabetic or numeric character or underscore.
     */
    static boolean isIdentifierContinue(int c) {
        if (isIdentifierStart(c)) {
            return true;
        }
        if (c == SourceLine.EOL) {
            return false;
        }
        int type = Character.getType(c);
        return type == Character.DECIMAL_DIGIT_NUMBER
                || type == Character.LETTER_NUMBER
                || type == Character.OTHER_NUMBER;
    }

    int bracketDepth() {
        return bracketDepth;
    }
}
