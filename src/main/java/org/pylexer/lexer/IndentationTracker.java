package org.pylexer.lexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Maintains the indentation stack and decides, at the start of each physical line
 * outside brackets, whether an indent, one or more dedents, or a misalignment error
 * must be emitted.
 * <p>
 * The stack always holds the base level 0 and is strictly increasing from bottom to top.
 */
final class IndentationTracker {

    private static final Logger LOGGER = LoggerFactory.getLogger(IndentationTracker.class);

    /**
     * Outcome of evaluating a line start.
     */
    enum LineStart {
        /** Empty or comment-only line: skip it without tokens. */
        BLANK,
        /** Deeper than the current level: an indent was pushed. */
        INDENT,
        /** Shallower than the current level: dedents are pending. */
        DEDENT,
        /** Same level: scan normally. */
        SAME
    }

    private final List<Integer> stack = new ArrayList<>();
    private PendingDedents pending = PendingDedents.NONE;

    IndentationTracker() {
        stack.add(0);
    }

    /**
     * Evaluates the indentation of a fresh physical line and updates the stack.
     *
     * @param line The line, positioned after its leading whitespace.
     * @return The decision for this line.
     * @throws LexerInvariantException if the stack has been emptied.
     */
    LineStart evaluate(SourceLine line) {
        int top = top();
        if (line.isLogicallyBlank()) {
            return LineStart.BLANK;
        }

        int width = line.indentation();
        if (width > top) {
            stack.add(width);
            return LineStart.INDENT;
        }
        if (width == top) {
            return LineStart.SAME;
        }

        int popped = 0;
        while (width < stack.get(stack.size() - 1)) {
            stack.remove(stack.size() - 1);
            popped++;
        }
        if (stack.get(stack.size() - 1) == width) {
            pending = new PendingDedents.Balanced(popped);
        } else {
            pending = new PendingDedents.Mismatched(popped);
            LOGGER.debug("Line {}: indentation width {} matches no enclosing level", line.number(), width);
        }
        return LineStart.DEDENT;
    }

    boolean hasPendingDedents() {
        return !pending.isEmpty();
    }

    /**
     * Emits the next pending dedent item.
     *
     * @param lineNumber The line the item is reported on.
     * @return A dedent token, or the misalignment error closing a mismatched run.
     */
    ScanResult drainOne(int lineNumber) {
        if (pending instanceof PendingDedents.Mismatched mismatched) {
            if (mismatched.remaining() == 1) {
                pending = PendingDedents.NONE;
                return ScanResult.error(lineNumber, LexerErrorKind.DEDENT);
            }
            pending = new PendingDedents.Mismatched(mismatched.remaining() - 1);
        } else {
            pending = new PendingDedents.Balanced(pending.remaining() - 1);
        }
        return ScanResult.ok(lineNumber, TokenType.DEDENT);
    }

    /**
     * Pops one open level at end of input.
     * @return {@code true} if a level was popped and a dedent must be emitted.
     */
    boolean closeLevelAtEnd() {
        if (stack.size() <= 1) {
            return false;
        }
        stack.remove(stack.size() - 1);
        return true;
    }

    /**
     * @return The number of entries on the stack, the base level included.
     */
    int depth() {
        return stack.size();
    }

    private int top() {
        if (stack.isEmpty()) {
            throw new LexerInvariantException("Indentation stack is empty");
        }
        return stack.get(stack.size() - 1);
    }
}
