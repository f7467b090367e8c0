package org.pylexer.lexer;

/**
 * A pull-based source of lexer output. Stages are composed as decorators: each stage
 * owns the stage it reads from and only advances it when pulled.
 */
public interface ITokenStream {

    /**
     * Produces the next item.
     * @return The next token or error, or {@code null} once the stream is exhausted.
     */
    ScanResult pull();
}
