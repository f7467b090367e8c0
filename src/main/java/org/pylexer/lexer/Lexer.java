package org.pylexer.lexer;

import org.pylexer.diagnostics.DiagnosticsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * The Lexer converts Python-family source text into a lazily produced sequence of
 * tokens and errors, each tagged with its source line.
 * <p>
 * Output is assembled from three stages: the core scanner, a stage joining adjacent byte
 * literals, and a stage joining adjacent string literals. Nothing is scanned until an item
 * is requested. A lexer is single-use and not thread-safe; construct a new one to rescan.
 */
public class Lexer implements Iterator<ScanResult> {

    private static final Logger LOGGER = LoggerFactory.getLogger(Lexer.class);

    private final ITokenStream stream;
    private final String logicalFileName;
    private ScanResult lookahead;
    private boolean exhausted = false;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string, already decoded.
     */
    public Lexer(String source) {
        this(source, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string, already decoded.
     * @param logicalFileName The name of the file being scanned, for diagnostics.
     */
    public Lexer(String source, String logicalFileName) {
        this.stream = new StringJoiningStream(new BytesJoiningStream(new CoreScanner(source)));
        this.logicalFileName = logicalFileName;
    }

    @Override
    public boolean hasNext() {
        if (lookahead == null && !exhausted) {
            lookahead = stream.pull();
            if (lookahead == null) {
                exhausted = true;
                LOGGER.trace("End of input reached for {}", logicalFileName);
            }
        }
        return lookahead != null;
    }

    @Override
    public ScanResult next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more tokens in " + logicalFileName);
        }
        ScanResult result = lookahead;
        lookahead = null;
        return result;
    }

    /**
     * @return The remaining items as a sequential, ordered stream.
     */
    public Stream<ScanResult> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    /**
     * Drains the lexer, reporting every error to the diagnostics engine.
     *
     * @param diagnostics The engine for reporting errors.
     * @return The successfully scanned tokens with their lines, in source order.
     */
    public List<ScanResult> scanAll(DiagnosticsEngine diagnostics) {
        List<ScanResult> tokens = new ArrayList<>();
        int errors = 0;
        while (hasNext()) {
            ScanResult result = next();
            if (result.isOk()) {
                tokens.add(result);
            } else {
                diagnostics.report(result.error(), logicalFileName, result.line());
                errors++;
            }
        }
        LOGGER.debug("Scanned {} tokens from {} ({} errors)", tokens.size(), logicalFileName, errors);
        return tokens;
    }

    /**
     * Scans a whole source buffer.
     * @param source The source code.
     * @return Every token and error, in source order.
     */
    public static List<ScanResult> tokenize(String source) {
        List<ScanResult> results = new ArrayList<>();
        new Lexer(source).forEachRemaining(results::add);
        return results;
    }
}
