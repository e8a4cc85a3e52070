package com.jsonloom.service.core.atomic;

import com.jsonloom.core.resources.Identifiable;
import com.jsonloom.core.resources.RelationshipAttribute;
import com.jsonloom.service.core.request.JsonApiRequest;
import com.jsonloom.service.core.request.TargetedFields;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One entry of an atomic-operations request. The resource carries the identifier (or local ID) of
 * the target plus the sent field values; for relationship operations the relationship value on the
 * resource holds the right-side references.
 */
public final class OperationContainer {
    private final OperationKind kind;
    private final Identifiable<?> resource;
    private final TargetedFields targetedFields;
    private final JsonApiRequest request;

    public OperationContainer(
            OperationKind kind, Identifiable<?> resource, TargetedFields targetedFields, JsonApiRequest request) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.resource = Objects.requireNonNull(resource, "resource");
        this.targetedFields = Objects.requireNonNull(targetedFields, "targetedFields");
        this.request = Objects.requireNonNull(request, "request");
        if (kind.isRelationshipOperation() && request.relationship() == null) {
            throw new IllegalArgumentException("Relationship operations require a target relationship");
        }
    }

    public OperationKind getKind() {
        return kind;
    }

    public Identifiable<?> getResource() {
        return resource;
    }

    public TargetedFields getTargetedFields() {
        return targetedFields;
    }

    public JsonApiRequest getRequest() {
        return request;
    }

    public RelationshipAttribute getRelationship() {
        return request.relationship();
    }

    /** Right-side references: of the targeted relationship, or of every relationship sent in the body. */
    public List<Identifiable<?>> getSecondaryResources() {
        List<Identifiable<?>> secondaries = new ArrayList<>();
        if (kind.isRelationshipOperation()) {
            secondaries.addAll(request.relationship().getRightResources(resource));
        } else {
            for (RelationshipAttribute relationship : targetedFields.relationships()) {
                secondaries.addAll(relationship.getRightResources(resource));
            }
        }
        secondaries.removeIf(Objects::isNull);
        return secondaries;
    }

    /** A copy targeting a different resource instance, typically the one returned by the service. */
    public OperationContainer withResource(Identifiable<?> newResource) {
        return new OperationContainer(kind, newResource, targetedFields, request);
    }

    @Override
    public String toString() {
        return kind + " " + request.primaryResource() + " " + resource;
    }
}
