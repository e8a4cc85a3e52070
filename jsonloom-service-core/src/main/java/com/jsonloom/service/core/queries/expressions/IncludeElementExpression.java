package com.jsonloom.service.core.queries.expressions;

import com.jsonloom.core.resources.RelationshipAttribute;
import java.util.ArrayList;
import java.util.List;

/** A relationship in the include tree, with the relationships included beneath it. */
public record IncludeElementExpression(RelationshipAttribute relationship, List<IncludeElementExpression> children)
        implements QueryExpression {

    public IncludeElementExpression {
        children = List.copyOf(children);
    }

    public IncludeElementExpression(RelationshipAttribute relationship) {
        this(relationship, List.of());
    }

    @Override
    public String toString() {
        List<String> chains = new ArrayList<>();
        IncludeExpression.collectChains(this, relationship.getPublicName(), chains);
        return String.join(",", chains);
    }
}
