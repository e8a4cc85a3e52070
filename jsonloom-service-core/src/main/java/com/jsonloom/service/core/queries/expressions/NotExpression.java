package com.jsonloom.service.core.queries.expressions;

public record NotExpression(FilterExpression child) implements FilterExpression {

    @Override
    public String toString() {
        return "not(" + child + ")";
    }
}
