package org.pylexer.lexer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Matches operators and punctuation by maximal munch. Operators are grouped into
 * families by their first character and tried longest first, so {@code **=} wins over
 * {@code **}, {@code *=} and {@code *}.
 * <p>
 * Two dots are not an operator: {@code ..} scans as a single {@code .}, leaving the
 * second dot for the next token. A lone {@code !} is invalid.
 */
final class SymbolScanner {

    private static final Map<Integer, List<TokenType>> FAMILIES = buildFamilies();

    private SymbolScanner() {}

    private static Map<Integer, List<TokenType>> buildFamilies() {
        Map<Integer, List<TokenType>> families = new HashMap<>();
        Arrays.stream(TokenType.values())
                .filter(t -> t.category() == TokenType.Category.OPERATOR)
                .forEach(t -> families.computeIfAbsent(t.lexeme().codePointAt(0), k -> new ArrayList<>()).add(t));
        Map<Integer, List<TokenType>> sorted = new HashMap<>();
        families.forEach((first, members) -> {
            members.sort(Comparator.comparingInt((TokenType t) -> t.lexeme().length()).reversed());
            sorted.put(first, Collections.unmodifiableList(members));
        });
        return Collections.unmodifiableMap(sorted);
    }

    /**
     * Scans one operator at the cursor. An unknown character is consumed and reported,
     * so the scanner always makes progress.
     */
    static ScanResult scan(SourceLine line) {
        int lineNumber = line.number();
        int first = line.peek();
        List<TokenType> family = FAMILIES.get(first);
        if (family != null) {
            for (TokenType candidate : family) {
                if (matches(line, candidate.lexeme())) {
                    for (int i = 0; i < candidate.lexeme().length(); i++) {
                        line.advance();
                    }
                    return ScanResult.ok(lineNumber, candidate);
                }
            }
        }
        if (first == SourceLine.EOL) {
            return ScanResult.error(lineNumber, LexerError.internal("error processing symbol"));
        }
        line.advance();
        return ScanResult.error(lineNumber, LexerError.invalidSymbol(first));
    }

    private static boolean matches(SourceLine line, String lexeme) {
        for (int i = 0; i < lexeme.length(); i++) {
            if (line.peekAt(i) != lexeme.charAt(i)) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return The change in bracket nesting caused by the given token type: 1, -1 or 0.
     */
    static int nestingDelta(TokenType type) {
        return switch (type) {
            case LPAREN, LBRACKET, LBRACE -> 1;
            case RPAREN, RBRACKET, RBRACE -> -1;
            default -> 0;
        };
    }
}
