package com.jsonloom.service.core.atomic.processors;

import com.jsonloom.core.resources.Identifiable;
import com.jsonloom.core.resources.RelationshipAttribute;
import com.jsonloom.core.resources.ResourceIdentity;
import com.jsonloom.service.core.atomic.OperationContainer;
import com.jsonloom.service.core.atomic.OperationProcessor;
import com.jsonloom.service.core.services.ResourceService;

/** Replaces a relationship. To-many values are de-duplicated; a to-one value passes through as is. */
public class SetRelationshipProcessor<T extends Identifiable<ID>, ID> implements OperationProcessor {
    private final ResourceService<T, ID> resourceService;

    public SetRelationshipProcessor(ResourceService<T, ID> resourceService) {
        this.resourceService = resourceService;
    }

    @Override
    public OperationContainer process(OperationContainer operation) {
        T primary = resourceService.getResourceClass().cast(operation.getResource());
        RelationshipAttribute relationship = operation.getRelationship();

        Object rightValue = relationship.isToMany()
                ? ResourceIdentity.distinct(relationship.getRightResources(primary))
                : relationship.getValue(primary);

        resourceService.setRelationship(primary.getId(), relationship.getPublicName(), rightValue);
        return null;
    }
}
