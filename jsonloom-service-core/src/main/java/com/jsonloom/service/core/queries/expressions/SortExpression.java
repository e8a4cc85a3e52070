package com.jsonloom.service.core.queries.expressions;

import java.util.List;
import java.util.stream.Collectors;

public record SortExpression(List<SortElementExpression> elements) implements QueryExpression {

    public SortExpression {
        if (elements.isEmpty()) {
            throw new IllegalArgumentException("At least one sort element is required");
        }
        elements = List.copyOf(elements);
    }

    @Override
    public String toString() {
        return elements.stream().map(Object::toString).collect(Collectors.joining(","));
    }
}
