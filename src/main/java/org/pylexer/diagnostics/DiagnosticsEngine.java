package org.pylexer.diagnostics;

import org.pylexer.lexer.LexerError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects diagnostics reported while a source is tokenized.
 * <p>
 * The lexer itself yields errors inline; this engine lets a consumer gather them
 * without interrupting the token stream.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports a lexer error, using its kind as the diagnostic code.
     *
     * @param error      The error yielded by the lexer.
     * @param fileName   The file in which the error occurred.
     * @param lineNumber The line the lexer tagged the error with.
     */
    public void report(LexerError error, String fileName, int lineNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, error.kind().name(), error.message(), fileName, lineNumber));
    }

    /**
     * Reports an error that did not come from the lexer.
     *
     * @param message    The error message.
     * @param fileName   The file in which the error occurred.
     * @param lineNumber The line number of the error.
     */
    public void reportError(String message, String fileName, int lineNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, null, message, fileName, lineNumber));
    }

    /**
     * Reports a warning. Warnings never make {@link #hasErrors()} true.
     *
     * @param message    The warning message.
     * @param fileName   The file the warning refers to.
     * @param lineNumber The line number of the warning.
     */
    public void reportWarning(String message, String fileName, int lineNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, null, message, fileName, lineNumber));
    }

    /**
     * @return {@code true} if at least one error was reported.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Counts the errors reported so far, across every source fed to this engine.
     *
     * @return The number of error diagnostics.
     */
    public long errorCount() {
        return diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.ERROR).count();
    }

    /**
     * Returns an unmodifiable view of all collected diagnostics, in report order.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics, one per line.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
