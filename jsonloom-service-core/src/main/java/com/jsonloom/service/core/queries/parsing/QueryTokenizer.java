package com.jsonloom.service.core.queries.parsing;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits query string values into tokens. Single-quoted text may contain any character; a quote
 * inside it is written as two quotes. A minus sign is a token of its own only at the start of a word.
 */
public final class QueryTokenizer {
    private final String source;
    private final StringBuilder textBuffer = new StringBuilder();
    private final List<Token> tokens = new ArrayList<>();
    private int offset;
    private boolean inQuotedSection;

    public QueryTokenizer(String source) {
        this.source = source;
    }

    public List<Token> tokenize() {
        tokens.clear();
        textBuffer.setLength(0);
        offset = 0;
        inQuotedSection = false;

        while (offset < source.length()) {
            char ch = source.charAt(offset);
            TokenKind singleCharacterKind = inQuotedSection ? null : TokenKind.forSymbol(ch);

            if (singleCharacterKind != null && !isMinusInsideText(singleCharacterKind)) {
                flushText();
                tokens.add(new Token(singleCharacterKind));
            } else if (ch == '\'') {
                if (inQuotedSection) {
                    if (peek() == '\'') {
                        textBuffer.append('\'');
                        offset++;
                    } else {
                        inQuotedSection = false;
                        tokens.add(new Token(TokenKind.QUOTED_TEXT, textBuffer.toString()));
                        textBuffer.setLength(0);
                    }
                } else {
                    if (textBuffer.length() > 0) {
                        throw new QueryParseException("Unexpected ' at position " + (offset + 1) + ".");
                    }
                    inQuotedSection = true;
                }
            } else if (Character.isWhitespace(ch) && !inQuotedSection) {
                flushText();
            } else {
                textBuffer.append(ch);
            }
            offset++;
        }

        if (inQuotedSection) {
            throw new QueryParseException("' expected.");
        }
        flushText();
        return List.copyOf(tokens);
    }

    private boolean isMinusInsideText(TokenKind kind) {
        return kind == TokenKind.MINUS && textBuffer.length() > 0;
    }

    private char peek() {
        return offset + 1 < source.length() ? source.charAt(offset + 1) : '\0';
    }

    private void flushText() {
        if (textBuffer.length() > 0) {
            tokens.add(new Token(TokenKind.TEXT, textBuffer.toString()));
            textBuffer.setLength(0);
        }
    }
}
