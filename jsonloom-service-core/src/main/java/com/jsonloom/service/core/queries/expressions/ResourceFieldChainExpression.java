package com.jsonloom.service.core.queries.expressions;

import com.jsonloom.core.resources.AttrAttribute;
import com.jsonloom.core.resources.RelationshipAttribute;
import com.jsonloom.core.resources.ResourceFieldAttribute;
import java.util.List;
import java.util.stream.Collectors;

/** A dot-separated path of fields, for example {@code author.address.city}. */
public record ResourceFieldChainExpression(List<ResourceFieldAttribute> fields) implements QueryExpression {

    public ResourceFieldChainExpression {
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("Field chain cannot be empty");
        }
        fields = List.copyOf(fields);
    }

    public ResourceFieldChainExpression(ResourceFieldAttribute field) {
        this(List.of(field));
    }

    public ResourceFieldAttribute getLastField() {
        return fields.get(fields.size() - 1);
    }

    /** The attribute at the end of the chain, or null when the chain ends in a relationship. */
    public AttrAttribute getTargetAttribute() {
        return getLastField() instanceof AttrAttribute attribute ? attribute : null;
    }

    /** The relationship at the end of the chain, or null when the chain ends in an attribute. */
    public RelationshipAttribute getTargetRelationship() {
        return getLastField() instanceof RelationshipAttribute relationship ? relationship : null;
    }

    @Override
    public String toString() {
        return fields.stream().map(ResourceFieldAttribute::getPublicName).collect(Collectors.joining("."));
    }
}
