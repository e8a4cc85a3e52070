package com.jsonloom.service.core.queries.expressions;

import java.util.List;
import java.util.stream.Collectors;

public record LogicalExpression(LogicalOperator operator, List<FilterExpression> terms) implements FilterExpression {

    public LogicalExpression {
        if (terms.size() < 2) {
            throw new IllegalArgumentException("At least two terms are required");
        }
        terms = List.copyOf(terms);
    }

    /** Combines terms with OR, returning the single term as-is. Identical terms collapse. */
    public static FilterExpression or(List<FilterExpression> terms) {
        List<FilterExpression> distinct = terms.stream().distinct().toList();
        return distinct.size() == 1 ? distinct.get(0) : new LogicalExpression(LogicalOperator.OR, distinct);
    }

    @Override
    public String toString() {
        return operator.keyword() + "(" + terms.stream().map(Object::toString).collect(Collectors.joining(",")) + ")";
    }
}
