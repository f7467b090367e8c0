package org.pylexer.lexer;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Static table mapping reserved words to their keyword token types.
 * {@code async} and {@code await} are not reserved and scan as identifiers.
 */
public final class Keywords {

    private static final Map<String, TokenType> KEYWORDS = Arrays.stream(TokenType.values())
            .filter(t -> t.category() == TokenType.Category.KEYWORD)
            .collect(Collectors.toUnmodifiableMap(TokenType::lexeme, Function.identity()));

    private Keywords() {}

    /**
     * Looks up a reserved word. The match is case-sensitive.
     * @param word The candidate word.
     * @return The keyword type, or empty if the word is not reserved.
     */
    public static Optional<TokenType> lookup(String word) {
        return Optional.ofNullable(KEYWORDS.get(word));
    }

    /**
     * Classifies a scanned name as a keyword token or an identifier token.
     * @param name The scanned name.
     * @return The matching token.
     */
    public static Token classify(String name) {
        TokenType keyword = KEYWORDS.get(name);
        return keyword != null ? Token.of(keyword) : Token.identifier(name);
    }

    /**
     * @return The number of reserved words.
     */
    public static int size() {
        return KEYWORDS.size();
    }
}
