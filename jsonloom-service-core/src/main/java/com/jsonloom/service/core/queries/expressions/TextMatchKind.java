package com.jsonloom.service.core.queries.expressions;

public enum TextMatchKind {
    CONTAINS("contains"),
    STARTS_WITH("startsWith"),
    ENDS_WITH("endsWith");

    private final String keyword;

    TextMatchKind(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static TextMatchKind fromKeyword(String keyword) {
        for (TextMatchKind kind : values()) {
            if (kind.keyword.equals(keyword)) {
                return kind;
            }
        }
        return null;
    }
}
