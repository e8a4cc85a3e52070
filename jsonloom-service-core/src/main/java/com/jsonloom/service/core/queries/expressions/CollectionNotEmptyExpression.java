package com.jsonloom.service.core.queries.expressions;

/** {@code has(toMany)}: the to-many relationship holds at least one resource. */
public record CollectionNotEmptyExpression(ResourceFieldChainExpression targetCollection) implements FilterExpression {

    @Override
    public String toString() {
        return "has(" + targetCollection + ")";
    }
}
