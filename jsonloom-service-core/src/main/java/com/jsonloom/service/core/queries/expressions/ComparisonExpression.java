package com.jsonloom.service.core.queries.expressions;

public record ComparisonExpression(ComparisonOperator operator, QueryExpression left, QueryExpression right)
        implements FilterExpression {

    @Override
    public String toString() {
        return operator.keyword() + "(" + left + "," + right + ")";
    }
}
