package com.jsonloom.service.core.atomic.processors;

import com.jsonloom.core.resources.Identifiable;
import com.jsonloom.service.core.atomic.OperationContainer;
import com.jsonloom.service.core.atomic.OperationProcessor;
import com.jsonloom.service.core.services.ResourceService;

public class CreateProcessor<T extends Identifiable<ID>, ID> implements OperationProcessor {
    private final ResourceService<T, ID> resourceService;

    public CreateProcessor(ResourceService<T, ID> resourceService) {
        this.resourceService = resourceService;
    }

    @Override
    public OperationContainer process(OperationContainer operation) {
        T resource = resourceService.getResourceClass().cast(operation.getResource());
        T created = resourceService.create(resource, operation.getTargetedFields());
        return created == null ? null : operation.withResource(created);
    }
}
