package com.jsonloom.service.core.request;

import com.jsonloom.core.resources.RelationshipAttribute;
import com.jsonloom.core.resources.ResourceContext;

/**
 * What a single request (or a single atomic operation) targets.
 *
 * @param kind endpoint shape
 * @param primaryResource resource type from the route or the operation; null for the atomic endpoint itself
 * @param primaryId route identifier, when present
 * @param relationship targeted relationship for secondary and relationship endpoints
 * @param collection whether the response holds a collection of resources
 */
public record JsonApiRequest(
        EndpointKind kind,
        ResourceContext primaryResource,
        String primaryId,
        RelationshipAttribute relationship,
        boolean collection) {

    public static JsonApiRequest forCollection(ResourceContext resource) {
        return new JsonApiRequest(EndpointKind.PRIMARY, resource, null, null, true);
    }

    public static JsonApiRequest forSingle(ResourceContext resource, String id) {
        return new JsonApiRequest(EndpointKind.PRIMARY, resource, id, null, false);
    }

    public static JsonApiRequest forRelationship(ResourceContext resource, String id, RelationshipAttribute relationship) {
        return new JsonApiRequest(EndpointKind.RELATIONSHIP, resource, id, relationship, relationship.isToMany());
    }

    public static JsonApiRequest forAtomicOperations() {
        return new JsonApiRequest(EndpointKind.ATOMIC_OPERATIONS, null, null, null, false);
    }

    /** The resource type that query string parameters apply to. */
    public ResourceContext getRequestResource() {
        return relationship != null ? relationship.getRightType() : primaryResource;
    }
}
