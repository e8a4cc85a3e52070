package com.jsonloom.service.core.queries.parsing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;

class QueryTokenizerTest {

    @Test
    void splitsFunctionCallIntoTokens() {
        List<Token> tokens = new QueryTokenizer("equals(name,'x y')").tokenize();

        assertThat(tokens)
                .containsExactly(
                        new Token(TokenKind.TEXT, "equals"),
                        new Token(TokenKind.OPEN_PARENTHESIS),
                        new Token(TokenKind.TEXT, "name"),
                        new Token(TokenKind.COMMA),
                        new Token(TokenKind.QUOTED_TEXT, "x y"),
                        new Token(TokenKind.CLOSE_PARENTHESIS));
    }

    @Test
    void doubledQuoteIsEscape() {
        List<Token> tokens = new QueryTokenizer("'it''s'").tokenize();

        assertEquals(List.of(new Token(TokenKind.QUOTED_TEXT, "it's")), tokens);
    }

    @Test
    void minusIsTokenOnlyAtStartOfWord() {
        assertThat(new QueryTokenizer("-name").tokenize())
                .containsExactly(new Token(TokenKind.MINUS), new Token(TokenKind.TEXT, "name"));
        assertThat(new QueryTokenizer("first-name").tokenize())
                .containsExactly(new Token(TokenKind.TEXT, "first-name"));
    }

    @Test
    void emptyQuotedTextIsKept() {
        assertThat(new QueryTokenizer("''").tokenize()).containsExactly(new Token(TokenKind.QUOTED_TEXT, ""));
    }

    @Test
    void unterminatedQuoteFails() {
        assertThatThrownBy(() -> new QueryTokenizer("equals(name,'abc").tokenize())
                .isInstanceOf(QueryParseException.class)
                .hasMessage("' expected.");
    }
}
