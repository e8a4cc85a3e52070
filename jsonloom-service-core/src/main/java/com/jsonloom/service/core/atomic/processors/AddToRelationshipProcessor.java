package com.jsonloom.service.core.atomic.processors;

import com.jsonloom.core.resources.Identifiable;
import com.jsonloom.core.resources.RelationshipAttribute;
import com.jsonloom.core.resources.ResourceIdentity;
import com.jsonloom.service.core.atomic.OperationContainer;
import com.jsonloom.service.core.atomic.OperationProcessor;
import com.jsonloom.service.core.services.ResourceService;

public class AddToRelationshipProcessor<T extends Identifiable<ID>, ID> implements OperationProcessor {
    private final ResourceService<T, ID> resourceService;

    public AddToRelationshipProcessor(ResourceService<T, ID> resourceService) {
        this.resourceService = resourceService;
    }

    @Override
    public OperationContainer process(OperationContainer operation) {
        T primary = resourceService.getResourceClass().cast(operation.getResource());
        RelationshipAttribute relationship = operation.getRelationship();

        resourceService.addToToManyRelationship(
                primary.getId(),
                relationship.getPublicName(),
                ResourceIdentity.distinct(relationship.getRightResources(primary)));
        return null;
    }
}
