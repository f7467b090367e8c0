package org.pylexer.lexer;

import java.util.List;

/**
 * Concatenates adjacent string literals, e.g. {@code 'a' "b"} becomes {@code "ab"}.
 */
public class StringJoiningStream extends AbstractLiteralJoiningStream {

    public StringJoiningStream(ITokenStream inner) {
        super(inner, TokenType.STRING);
    }

    @Override
    protected Token merge(List<Token> run) {
        StringBuilder joined = new StringBuilder();
        run.forEach(token -> joined.append(token.text()));
        return Token.string(joined.toString());
    }
}
