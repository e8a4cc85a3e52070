package com.jsonloom.service.core.queries.expressions;

import com.jsonloom.core.resources.ResourceFieldAttribute;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/** The attributes and relationships requested for one resource type. */
public record SparseFieldSetExpression(Set<ResourceFieldAttribute> fields) implements QueryExpression {

    public SparseFieldSetExpression {
        fields = Collections.unmodifiableSet(new LinkedHashSet<>(fields));
    }

    public boolean contains(ResourceFieldAttribute field) {
        return fields.contains(field);
    }

    @Override
    public String toString() {
        return fields.stream().map(ResourceFieldAttribute::getPublicName).collect(Collectors.joining(","));
    }
}
