package com.jsonloom.service.core.queries.expressions;

public enum ComparisonOperator {
    EQUALS("equals"),
    GREATER_THAN("greaterThan"),
    GREATER_OR_EQUAL("greaterOrEqual"),
    LESS_THAN("lessThan"),
    LESS_OR_EQUAL("lessOrEqual");

    private final String keyword;

    ComparisonOperator(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static ComparisonOperator fromKeyword(String keyword) {
        for (ComparisonOperator operator : values()) {
            if (operator.keyword.equals(keyword)) {
                return operator;
            }
        }
        return null;
    }
}
