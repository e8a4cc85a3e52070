package com.jsonloom.service.core.queries.expressions;

import com.jsonloom.core.resources.ResourceContext;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/** Sparse fieldsets keyed by resource type. */
public record SparseFieldTableExpression(Map<ResourceContext, SparseFieldSetExpression> table)
        implements QueryExpression {

    public SparseFieldTableExpression {
        table = Collections.unmodifiableMap(new LinkedHashMap<>(table));
    }

    @Override
    public String toString() {
        return table.entrySet().stream()
                .map(e -> e.getKey().getPublicName() + "(" + e.getValue() + ")")
                .collect(Collectors.joining(","));
    }
}
