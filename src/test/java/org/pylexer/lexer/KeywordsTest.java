package org.pylexer.lexer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link Keywords} table.
 */
@Tag("unit")
class KeywordsTest {

    @Test
    void holdsExactlyTheReservedWords() {
        assertThat(Keywords.size()).isEqualTo(33);
        assertThat(Keywords.lookup("nonlocal")).contains(TokenType.NONLOCAL);
        assertThat(Keywords.lookup("None")).contains(TokenType.NONE);
    }

    @Test
    void lookupIsCaseSensitiveAndExcludesSoftKeywords() {
        assertThat(Keywords.lookup("none")).isEmpty();
        assertThat(Keywords.lookup("IF")).isEmpty();
        assertThat(Keywords.lookup("async")).isEmpty();
        assertThat(Keywords.lookup("await")).isEmpty();
        assertThat(Keywords.lookup("match")).isEmpty();
    }

    @Test
    void classifyYieldsKeywordOrIdentifierTokens() {
        assertThat(Keywords.classify("while")).isEqualTo(Token.of(TokenType.WHILE));
        assertThat(Keywords.classify("whiles")).isEqualTo(Token.identifier("whiles"));
    }
}
