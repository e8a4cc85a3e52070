package com.jsonloom.service.core.hooks.traversal;

import com.jsonloom.core.resources.Identifiable;
import com.jsonloom.core.resources.RelationshipAttribute;
import com.jsonloom.core.resources.ResourceContext;
import com.jsonloom.core.resources.ResourceGraph;
import com.jsonloom.core.resources.ResourceIdentity;
import com.jsonloom.service.core.queries.expressions.IncludeElementExpression;
import com.jsonloom.service.core.queries.expressions.IncludeExpression;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Depth-first walk from a set of resources along the relationships named by an include tree.
 * Relationships outside the tree are never read, even when the fetched instances hold values for
 * them. The walk is bounded by the depth of the tree, so cyclic data terminates.
 */
public class ResourceTreeTraversal {
    private final ResourceGraph resourceGraph;

    public ResourceTreeTraversal(ResourceGraph resourceGraph) {
        this.resourceGraph = resourceGraph;
    }

    public TraversalResult traverse(Collection<? extends Identifiable<?>> roots, IncludeExpression include) {
        if (roots.isEmpty()) {
            throw new IllegalArgumentException("At least one root resource is required");
        }
        ResourceContext rootType = resourceGraph.getResourceContext(roots.iterator().next().getClass());

        Map<ResourceContext, Map<ResourceIdentity, Identifiable<?>>> buckets = new LinkedHashMap<>();
        for (Identifiable<?> root : roots) {
            add(buckets, rootType, root);
            walk(buckets, root, include.elements());
        }

        Map<ResourceContext, Set<Identifiable<?>>> resourcesByType = new LinkedHashMap<>();
        buckets.forEach((type, bucket) -> resourcesByType.put(type, new LinkedHashSet<>(bucket.values())));
        return new TraversalResult(rootType, resourcesByType);
    }

    private static void walk(
            Map<ResourceContext, Map<ResourceIdentity, Identifiable<?>>> buckets,
            Identifiable<?> parent,
            List<IncludeElementExpression> elements) {
        for (IncludeElementExpression element : elements) {
            RelationshipAttribute relationship = element.relationship();
            for (Identifiable<?> right : relationship.getRightResources(parent)) {
                if (right != null) {
                    add(buckets, relationship.getRightType(), right);
                    walk(buckets, right, element.children());
                }
            }
        }
    }

    private static void add(
            Map<ResourceContext, Map<ResourceIdentity, Identifiable<?>>> buckets,
            ResourceContext type,
            Identifiable<?> resource) {
        buckets.computeIfAbsent(type, t -> new LinkedHashMap<>()).putIfAbsent(ResourceIdentity.of(resource), resource);
    }
}
