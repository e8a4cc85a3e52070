package com.jsonloom.service.core.queries.expressions;

/**
 * One sort key: either an attribute chain or a {@link CountExpression}.
 */
public record SortElementExpression(QueryExpression target, boolean ascending) implements QueryExpression {

    public SortElementExpression {
        if (!(target instanceof ResourceFieldChainExpression) && !(target instanceof CountExpression)) {
            throw new IllegalArgumentException("Sort target must be a field chain or count()");
        }
    }

    @Override
    public String toString() {
        return (ascending ? "" : "-") + target;
    }
}
