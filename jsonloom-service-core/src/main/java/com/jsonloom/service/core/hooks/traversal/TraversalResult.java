package com.jsonloom.service.core.hooks.traversal;

import com.jsonloom.core.resources.Identifiable;
import com.jsonloom.core.resources.ResourceContext;
import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * Instances found along the include tree, grouped per type in discovery order.
 *
 * @param rootType type of the top-level instances
 * @param resourcesByType distinct instances of each type
 */
public record TraversalResult(ResourceContext rootType, Map<ResourceContext, Set<Identifiable<?>>> resourcesByType) {

    public TraversalResult {
        resourcesByType = Collections.unmodifiableMap(resourcesByType);
    }
}
