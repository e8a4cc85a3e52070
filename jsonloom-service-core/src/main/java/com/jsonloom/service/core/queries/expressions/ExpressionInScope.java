package com.jsonloom.service.core.queries.expressions;

/**
 * An expression together with the to-many relationship chain it applies to. A null scope means the
 * primary resource set.
 */
public record ExpressionInScope(ResourceFieldChainExpression scope, QueryExpression expression) {

    @Override
    public String toString() {
        return (scope == null ? "" : scope + ": ") + expression;
    }
}
