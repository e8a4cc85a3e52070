package com.jsonloom.service.core.atomic;

import com.jsonloom.core.errors.ErrorObject;
import com.jsonloom.core.errors.ErrorSource;
import com.jsonloom.core.errors.JsonApiException;
import com.jsonloom.core.resources.Identifiable;
import com.jsonloom.core.resources.RelationshipAttribute;
import com.jsonloom.core.resources.ResourceContext;
import com.jsonloom.core.resources.ResourceGraph;
import java.util.List;

/**
 * Checks local ID usage of a whole batch before anything executes: every local ID is declared by
 * a create before it is referenced, and declared only once. Errors point at the offending element.
 */
public class LocalIdValidator {
    private static final String PLACEHOLDER_ID = "";

    private final ResourceGraph resourceGraph;

    public LocalIdValidator(ResourceGraph resourceGraph) {
        this.resourceGraph = resourceGraph;
    }

    public void validate(List<OperationContainer> operations) {
        LocalIdTracker localIdTracker = new LocalIdTracker();
        int operationIndex = 0;
        try {
            for (OperationContainer operation : operations) {
                validateOperation(operation, localIdTracker);
                operationIndex++;
            }
        } catch (JsonApiException e) {
            for (ErrorObject error : e.getErrors()) {
                error.prependPointer("/atomic:operations[" + operationIndex + "]");
            }
            throw e;
        }
    }

    private void validateOperation(OperationContainer operation, LocalIdTracker localIdTracker) {
        Identifiable<?> resource = operation.getResource();
        OperationKind kind = operation.getKind();

        if (kind == OperationKind.CREATE_RESOURCE) {
            declareLocalId(resource, localIdTracker, "/data/lid");
        } else {
            String pointer = kind == OperationKind.UPDATE_RESOURCE ? "/data/lid" : "/ref/lid";
            assertLocalIdIsAssigned(resource, localIdTracker, pointer);
        }

        if (kind.isRelationshipOperation()) {
            RelationshipAttribute relationship = operation.getRelationship();
            assertSecondariesAreAssigned(relationship, resource, localIdTracker, "/data");
        } else {
            for (RelationshipAttribute relationship : operation.getTargetedFields().relationships()) {
                assertSecondariesAreAssigned(
                        relationship,
                        resource,
                        localIdTracker,
                        "/data/relationships/" + relationship.getPublicName() + "/data");
            }
        }

        if (kind == OperationKind.CREATE_RESOURCE) {
            assignLocalId(resource, localIdTracker);
        }
    }

    private void assertSecondariesAreAssigned(
            RelationshipAttribute relationship,
            Identifiable<?> resource,
            LocalIdTracker localIdTracker,
            String dataPointer) {
        List<Identifiable<?>> secondaries = relationship.getRightResources(resource);
        for (int i = 0; i < secondaries.size(); i++) {
            Identifiable<?> secondary = secondaries.get(i);
            if (secondary != null) {
                String pointer = relationship.isToMany() ? dataPointer + "[" + i + "]/lid" : dataPointer + "/lid";
                assertLocalIdIsAssigned(secondary, localIdTracker, pointer);
            }
        }
    }

    private void declareLocalId(Identifiable<?> resource, LocalIdTracker localIdTracker, String pointer) {
        if (resource.getLocalId() != null) {
            String resourceType = typeOf(resource).getPublicName();
            runAt(pointer, () -> localIdTracker.declare(resource.getLocalId(), resourceType));
        }
    }

    private void assignLocalId(Identifiable<?> resource, LocalIdTracker localIdTracker) {
        if (resource.getLocalId() != null) {
            localIdTracker.assign(resource.getLocalId(), typeOf(resource).getPublicName(), PLACEHOLDER_ID);
        }
    }

    private void assertLocalIdIsAssigned(Identifiable<?> resource, LocalIdTracker localIdTracker, String pointer) {
        if (resource.getLocalId() != null) {
            String resourceType = typeOf(resource).getPublicName();
            runAt(pointer, () -> localIdTracker.getValue(resource.getLocalId(), resourceType));
        }
    }

    private ResourceContext typeOf(Identifiable<?> resource) {
        return resourceGraph.getResourceContext(resource.getClass());
    }

    private static void runAt(String pointer, Runnable action) {
        try {
            action.run();
        } catch (JsonApiException e) {
            for (ErrorObject error : e.getErrors()) {
                if (error.getSource() == null) {
                    error.setSource(ErrorSource.forPointer(pointer));
                }
            }
            throw e;
        }
    }
}
