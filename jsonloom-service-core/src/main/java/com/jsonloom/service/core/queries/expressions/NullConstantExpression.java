package com.jsonloom.service.core.queries.expressions;

public record NullConstantExpression() implements QueryExpression {

    public static final NullConstantExpression INSTANCE = new NullConstantExpression();

    @Override
    public String toString() {
        return "null";
    }
}
