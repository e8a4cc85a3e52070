package com.jsonloom.service.core.queries.expressions;

/** {@code count(toMany)}: the number of resources in a to-many relationship. */
public record CountExpression(ResourceFieldChainExpression targetCollection) implements FunctionExpression {

    @Override
    public String toString() {
        return "count(" + targetCollection + ")";
    }
}
