package com.jsonloom.service.core.request;

import com.jsonloom.core.resources.AttrAttribute;
import com.jsonloom.core.resources.RelationshipAttribute;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The attributes and relationships a write request actually sent. Fields not listed keep their
 * stored value.
 */
public record TargetedFields(Set<AttrAttribute> attributes, Set<RelationshipAttribute> relationships) {

    public static final TargetedFields NONE = new TargetedFields(Set.of(), Set.of());

    public TargetedFields {
        attributes = Collections.unmodifiableSet(new LinkedHashSet<>(attributes));
        relationships = Collections.unmodifiableSet(new LinkedHashSet<>(relationships));
    }

    public boolean isEmpty() {
        return attributes.isEmpty() && relationships.isEmpty();
    }
}
