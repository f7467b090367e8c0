package org.pylexer.lexer;

/**
 * Defines the diagnosable error kinds the {@link Lexer} can yield in place of a token.
 * This decouples tests and consumers from the rendered error messages.
 */
public enum LexerErrorKind {
    /** A backslash not immediately followed by the end of the line. */
    BAD_LINE_CONTINUATION("backslash is not at the end of the line"),
    /** End of line or input inside a single-quoted literal. */
    UNTERMINATED_STRING("unterminated string literal"),
    /** End of input inside a triple-quoted literal. */
    UNTERMINATED_TRIPLE_STRING("unterminated triple-quoted string literal"),
    /** A disallowed character inside a byte-literal escape. */
    INVALID_CHARACTER("invalid character in byte literal escape"),
    /** A dedent that does not land on an enclosing indentation level. */
    DEDENT("unindent does not match any outer indentation level"),
    /** {@code \x} not followed by two hex digits. */
    HEX_ESCAPE_SHORT("\\x escape requires two hex digits"),
    /** A u or U escape not followed by four or eight hex digits. */
    MALFORMED_UNICODE_ESCAPE("malformed \\u or \\U escape"),
    /** {@code \N} without a closed brace-delimited name. */
    MALFORMED_NAMED_UNICODE_ESCAPE("malformed \\N{...} escape"),
    /** {@code \N{NAME}} naming no known character. */
    UNKNOWN_UNICODE_NAME("unknown unicode character name"),
    /** A radix prefix or exponent marker without the digits it requires. */
    MISSING_DIGITS("missing digits in numeric literal"),
    /** A float extension on an incompatible literal, or a zero-prefixed decimal. */
    MALFORMED_FLOAT("malformed float literal"),
    /** An imaginary suffix on an incompatible literal. */
    MALFORMED_IMAGINARY("malformed imaginary literal"),
    /** A character that starts no known operator. */
    INVALID_SYMBOL("invalid symbol"),
    /** A scanner state that should be unreachable. */
    INTERNAL("internal lexer error");

    private final String description;

    LexerErrorKind(String description) {
        this.description = description;
    }

    /**
     * @return A human-readable description of this error kind.
     */
    public String description() {
        return description;
    }
}
