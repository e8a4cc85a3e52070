package com.jsonloom.service.core.queries.parsing;

public enum TokenKind {
    OPEN_PARENTHESIS('('),
    CLOSE_PARENTHESIS(')'),
    OPEN_BRACKET('['),
    CLOSE_BRACKET(']'),
    COMMA(','),
    COLON(':'),
    MINUS('-'),
    TEXT('\0'),
    QUOTED_TEXT('\0');

    private final char symbol;

    TokenKind(char symbol) {
        this.symbol = symbol;
    }

    public char symbol() {
        return symbol;
    }

    static TokenKind forSymbol(char ch) {
        for (TokenKind kind : values()) {
            if (kind.symbol != '\0' && kind.symbol == ch) {
                return kind;
            }
        }
        return null;
    }
}
