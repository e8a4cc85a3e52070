package com.jsonloom.service.core.atomic.processors;

import com.jsonloom.core.resources.Identifiable;
import com.jsonloom.service.core.atomic.OperationContainer;
import com.jsonloom.service.core.atomic.OperationProcessor;
import com.jsonloom.service.core.services.ResourceService;

public class DeleteProcessor<T extends Identifiable<ID>, ID> implements OperationProcessor {
    private final ResourceService<T, ID> resourceService;

    public DeleteProcessor(ResourceService<T, ID> resourceService) {
        this.resourceService = resourceService;
    }

    @Override
    public OperationContainer process(OperationContainer operation) {
        T resource = resourceService.getResourceClass().cast(operation.getResource());
        resourceService.delete(resource.getId());
        return null;
    }
}
