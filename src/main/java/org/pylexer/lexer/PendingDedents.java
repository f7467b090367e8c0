package org.pylexer.lexer;

/**
 * The dedent tokens still owed after a line start popped indentation levels.
 * One item is drained per scanner pull.
 */
sealed interface PendingDedents permits PendingDedents.Balanced, PendingDedents.Mismatched {

    /** No dedents pending. */
    PendingDedents NONE = new Balanced(0);

    /**
     * @return The number of items still to emit.
     */
    int remaining();

    default boolean isEmpty() {
        return remaining() == 0;
    }

    /**
     * The dedent landed on an existing level: {@code remaining} ordinary dedents follow.
     * @param remaining The dedents still to emit.
     */
    record Balanced(int remaining) implements PendingDedents {}

    /**
     * The dedent landed between two levels. {@code remaining - 1} ordinary dedents are
     * emitted first and the last item is a single {@link LexerErrorKind#DEDENT} error.
     * @param remaining The items still to emit, the error included.
     */
    record Mismatched(int remaining) implements PendingDedents {}
}
