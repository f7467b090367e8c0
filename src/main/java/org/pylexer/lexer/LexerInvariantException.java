package org.pylexer.lexer;

/**
 * Thrown when an internal invariant of the lexer is violated. Unlike {@link LexerError},
 * this is not a property of the input and scanning cannot continue.
 */
public class LexerInvariantException extends IllegalStateException {

    /**
     * Constructs a new exception with the specified detail message.
     * @param message The detail message.
     */
    public LexerInvariantException(String message) {
        super(message);
    }
}
