package com.jsonloom.service.core.atomic;

import com.jsonloom.core.errors.UnsupportedOperationTypeException;
import com.jsonloom.core.resources.Identifiable;
import com.jsonloom.service.core.atomic.processors.AddToRelationshipProcessor;
import com.jsonloom.service.core.atomic.processors.CreateProcessor;
import com.jsonloom.service.core.atomic.processors.DeleteProcessor;
import com.jsonloom.service.core.atomic.processors.RemoveFromRelationshipProcessor;
import com.jsonloom.service.core.atomic.processors.SetRelationshipProcessor;
import com.jsonloom.service.core.atomic.processors.UpdateProcessor;
import com.jsonloom.service.core.services.ResourceService;
import com.jsonloom.service.core.services.ResourceServiceRegistry;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves the {@link OperationProcessor} for an operation from an explicit registry keyed by
 * resource class and operation kind.
 */
public class OperationProcessorAccessor {
    private final Map<Class<?>, Map<OperationKind, OperationProcessor>> processors = new ConcurrentHashMap<>();

    public OperationProcessorAccessor() {}

    /** Registers the standard processors for every service in the registry. */
    public OperationProcessorAccessor(ResourceServiceRegistry serviceRegistry) {
        serviceRegistry.getServices().forEach(this::registerDefaults);
    }

    public <T extends Identifiable<ID>, ID> void registerDefaults(ResourceService<T, ID> service) {
        Class<T> resourceClass = service.getResourceClass();
        register(resourceClass, OperationKind.CREATE_RESOURCE, new CreateProcessor<>(service));
        register(resourceClass, OperationKind.UPDATE_RESOURCE, new UpdateProcessor<>(service));
        register(resourceClass, OperationKind.DELETE_RESOURCE, new DeleteProcessor<>(service));
        register(resourceClass, OperationKind.SET_RELATIONSHIP, new SetRelationshipProcessor<>(service));
        register(resourceClass, OperationKind.ADD_TO_RELATIONSHIP, new AddToRelationshipProcessor<>(service));
        register(resourceClass, OperationKind.REMOVE_FROM_RELATIONSHIP, new RemoveFromRelationshipProcessor<>(service));
    }

    /** Adds or replaces the processor for one resource class and operation kind. */
    public void register(Class<?> resourceClass, OperationKind kind, OperationProcessor processor) {
        processors
                .computeIfAbsent(resourceClass, key -> new EnumMap<>(OperationKind.class))
                .put(kind, processor);
    }

    /**
     * @throws UnsupportedOperationTypeException when no processor is registered for the operation
     */
    public OperationContainer process(OperationContainer operation) {
        Class<?> resourceClass = operation.getRequest().primaryResource().getResourceClass();
        Map<OperationKind, OperationProcessor> byKind = processors.get(resourceClass);
        OperationProcessor processor = byKind == null ? null : byKind.get(operation.getKind());
        if (processor == null) {
            throw new UnsupportedOperationTypeException(
                    operation.getKind().name(), operation.getRequest().primaryResource().getPublicName());
        }
        return processor.process(operation);
    }
}
