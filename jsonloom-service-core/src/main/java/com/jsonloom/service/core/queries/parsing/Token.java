package com.jsonloom.service.core.queries.parsing;

public record Token(TokenKind kind, String value) {

    public Token(TokenKind kind) {
        this(kind, null);
    }

    @Override
    public String toString() {
        return value == null ? kind.name() : kind + ": " + value;
    }
}
