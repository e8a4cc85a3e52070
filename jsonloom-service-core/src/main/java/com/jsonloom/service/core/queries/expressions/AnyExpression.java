package com.jsonloom.service.core.queries.expressions;

import java.util.List;
import java.util.stream.Collectors;

/** Matches when the attribute equals any of the constants. Constants are distinct. */
public record AnyExpression(ResourceFieldChainExpression targetAttribute, List<LiteralConstantExpression> constants)
        implements FilterExpression {

    public AnyExpression {
        if (constants.isEmpty()) {
            throw new IllegalArgumentException("At least one constant is required");
        }
        constants = constants.stream().distinct().toList();
    }

    @Override
    public String toString() {
        return "any(" + targetAttribute + ","
                + constants.stream().map(Object::toString).collect(Collectors.joining(",")) + ")";
    }
}
