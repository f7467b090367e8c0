package org.pylexer.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * Base class for stages that merge runs of adjacent literal tokens of one type into a
 * single token, tagged with the line of the first literal in the run. Items of any other
 * type, errors included, pass through unchanged and end a run.
 */
public abstract class AbstractLiteralJoiningStream implements ITokenStream {

    private final ITokenStream inner;
    private final TokenType joinedType;
    private ScanResult lookahead;

    protected AbstractLiteralJoiningStream(ITokenStream inner, TokenType joinedType) {
        this.inner = inner;
        this.joinedType = joinedType;
    }

    @Override
    public ScanResult pull() {
        ScanResult first = take();
        if (first == null || !first.is(joinedType)) {
            return first;
        }

        List<Token> run = new ArrayList<>();
        run.add(first.token());
        while (peek() != null && peek().is(joinedType)) {
            run.add(take().token());
        }
        if (run.size() == 1) {
            return first;
        }
        return ScanResult.ok(first.line(), merge(run));
    }

    /**
     * Merges a run of at least two tokens of the joined type.
     * @param run The tokens in source order.
     * @return The merged token.
     */
    protected abstract Token merge(List<Token> run);

    private ScanResult peek() {
        if (lookahead == null) {
            lookahead = inner.pull();
        }
        return lookahead;
    }

    private ScanResult take() {
        ScanResult result = peek();
        lookahead = null;
        return result;
    }
}
