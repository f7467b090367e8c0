package org.pylexer.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 * <p>
 * Keywords and operators carry their canonical source lexeme; layout markers and
 * literal types do not, since their text is either synthesized or held by the {@link Token}.
 */
public enum TokenType {
    // region Layout
    /** End of a logical line. */
    NEWLINE(Category.LAYOUT, null),
    /** Entry into a more deeply indented block. */
    INDENT(Category.LAYOUT, null),
    /** Exit from an indented block. */
    DEDENT(Category.LAYOUT, null),
    // endregion

    // region Keywords
    FALSE(Category.KEYWORD, "False"),
    NONE(Category.KEYWORD, "None"),
    TRUE(Category.KEYWORD, "True"),
    AND(Category.KEYWORD, "and"),
    AS(Category.KEYWORD, "as"),
    ASSERT(Category.KEYWORD, "assert"),
    BREAK(Category.KEYWORD, "break"),
    CLASS(Category.KEYWORD, "class"),
    CONTINUE(Category.KEYWORD, "continue"),
    DEF(Category.KEYWORD, "def"),
    DEL(Category.KEYWORD, "del"),
    ELIF(Category.KEYWORD, "elif"),
    ELSE(Category.KEYWORD, "else"),
    EXCEPT(Category.KEYWORD, "except"),
    FINALLY(Category.KEYWORD, "finally"),
    FOR(Category.KEYWORD, "for"),
    FROM(Category.KEYWORD, "from"),
    GLOBAL(Category.KEYWORD, "global"),
    IF(Category.KEYWORD, "if"),
    IMPORT(Category.KEYWORD, "import"),
    IN(Category.KEYWORD, "in"),
    IS(Category.KEYWORD, "is"),
    LAMBDA(Category.KEYWORD, "lambda"),
    NONLOCAL(Category.KEYWORD, "nonlocal"),
    NOT(Category.KEYWORD, "not"),
    OR(Category.KEYWORD, "or"),
    PASS(Category.KEYWORD, "pass"),
    RAISE(Category.KEYWORD, "raise"),
    RETURN(Category.KEYWORD, "return"),
    TRY(Category.KEYWORD, "try"),
    WHILE(Category.KEYWORD, "while"),
    WITH(Category.KEYWORD, "with"),
    YIELD(Category.KEYWORD, "yield"),
    // endregion

    // region Operators
    PLUS(Category.OPERATOR, "+"),
    MINUS(Category.OPERATOR, "-"),
    TIMES(Category.OPERATOR, "*"),
    EXPONENT(Category.OPERATOR, "**"),
    DIVIDE(Category.OPERATOR, "/"),
    DIVIDE_FLOOR(Category.OPERATOR, "//"),
    MOD(Category.OPERATOR, "%"),
    AT(Category.OPERATOR, "@"),
    LSHIFT(Category.OPERATOR, "<<"),
    RSHIFT(Category.OPERATOR, ">>"),
    BIT_AND(Category.OPERATOR, "&"),
    BIT_OR(Category.OPERATOR, "|"),
    BIT_XOR(Category.OPERATOR, "^"),
    BIT_NOT(Category.OPERATOR, "~"),
    LT(Category.OPERATOR, "<"),
    GT(Category.OPERATOR, ">"),
    LE(Category.OPERATOR, "<="),
    GE(Category.OPERATOR, ">="),
    EQ(Category.OPERATOR, "=="),
    NE(Category.OPERATOR, "!="),
    // endregion

    // region Delimiters
    LPAREN(Category.OPERATOR, "("),
    RPAREN(Category.OPERATOR, ")"),
    LBRACKET(Category.OPERATOR, "["),
    RBRACKET(Category.OPERATOR, "]"),
    LBRACE(Category.OPERATOR, "{"),
    RBRACE(Category.OPERATOR, "}"),
    COMMA(Category.OPERATOR, ","),
    COLON(Category.OPERATOR, ":"),
    DOT(Category.OPERATOR, "."),
    ELLIPSIS(Category.OPERATOR, "..."),
    SEMI(Category.OPERATOR, ";"),
    ARROW(Category.OPERATOR, "->"),
    ASSIGN(Category.OPERATOR, "="),
    ASSIGN_PLUS(Category.OPERATOR, "+="),
    ASSIGN_MINUS(Category.OPERATOR, "-="),
    ASSIGN_TIMES(Category.OPERATOR, "*="),
    ASSIGN_DIVIDE(Category.OPERATOR, "/="),
    ASSIGN_DIVIDE_FLOOR(Category.OPERATOR, "//="),
    ASSIGN_MOD(Category.OPERATOR, "%="),
    ASSIGN_AT(Category.OPERATOR, "@="),
    ASSIGN_BIT_AND(Category.OPERATOR, "&="),
    ASSIGN_BIT_OR(Category.OPERATOR, "|="),
    ASSIGN_BIT_XOR(Category.OPERATOR, "^="),
    ASSIGN_RSHIFT(Category.OPERATOR, ">>="),
    ASSIGN_LSHIFT(Category.OPERATOR, "<<="),
    ASSIGN_EXPONENT(Category.OPERATOR, "**="),
    // endregion

    // region Literals
    /** An identifier that is not a keyword. */
    IDENTIFIER(Category.LITERAL, null),
    /** A string literal; the token holds the decoded text. */
    STRING(Category.LITERAL, null),
    /** A byte-string literal; the token holds the decoded bytes. */
    BYTES(Category.LITERAL, null),
    DEC_INTEGER(Category.NUMBER, null),
    BIN_INTEGER(Category.NUMBER, null),
    OCT_INTEGER(Category.NUMBER, null),
    HEX_INTEGER(Category.NUMBER, null),
    FLOAT(Category.NUMBER, null),
    IMAGINARY(Category.NUMBER, null);
    // endregion

    /**
     * Coarse classification of token types.
     */
    public enum Category {
        /** Synthesized markers with no source text. */
        LAYOUT,
        /** Reserved words. */
        KEYWORD,
        /** Operators and punctuation. */
        OPERATOR,
        /** Identifiers, strings and byte strings. */
        LITERAL,
        /** Numeric literals, which keep their exact source lexeme. */
        NUMBER
    }

    private final Category category;
    private final String lexeme;

    TokenType(Category category, String lexeme) {
        this.category = category;
        this.lexeme = lexeme;
    }

    /**
     * @return The category of this token type.
     */
    public Category category() {
        return category;
    }

    /**
     * Returns the canonical source text of a keyword or operator.
     *
     * @return The lexeme, or {@code null} for layout and literal types.
     */
    public String lexeme() {
        return lexeme;
    }

    /**
     * @return {@code true} if tokens of this type carry a textual payload.
     */
    public boolean hasText() {
        return category == Category.NUMBER || this == IDENTIFIER || this == STRING;
    }
}
