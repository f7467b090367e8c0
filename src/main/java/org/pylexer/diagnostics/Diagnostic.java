package org.pylexer.diagnostics;

/**
 * Represents a single diagnostic message (error, warning, info) produced while
 * tokenizing a source file.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param code A stable, testable code such as the lexer error kind name, or {@code null}.
 * @param message The diagnostic message.
 * @param fileName The name of the file where the issue occurred.
 * @param lineNumber The line number of the issue; 0 for positions past the last line.
 */
public record Diagnostic(
        Type type,
        String code,
        String message,
        String fileName,
        int lineNumber
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error in the source text. */
        ERROR,
        /** A suspicious construct that still tokenizes. */
        WARNING,
        /** An informational message. */
        INFO
    }

    @Override
    public String toString() {
        String prefix = code == null ? "" : code + ": ";
        return String.format("[%s] %s:%d: %s%s", type, fileName, lineNumber, prefix, message);
    }
}
