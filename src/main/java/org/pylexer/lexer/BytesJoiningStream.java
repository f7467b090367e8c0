package org.pylexer.lexer;

import java.io.ByteArrayOutputStream;
import java.util.List;

/**
 * Concatenates adjacent byte-string literals, e.g. {@code b'a' b'b'} becomes {@code b'ab'}.
 */
public class BytesJoiningStream extends AbstractLiteralJoiningStream {

    public BytesJoiningStream(ITokenStream inner) {
        super(inner, TokenType.BYTES);
    }

    @Override
    protected Token merge(List<Token> run) {
        ByteArrayOutputStream joined = new ByteArrayOutputStream();
        run.forEach(token -> joined.writeBytes(token.bytes()));
        return Token.bytes(joined.toByteArray());
    }
}
