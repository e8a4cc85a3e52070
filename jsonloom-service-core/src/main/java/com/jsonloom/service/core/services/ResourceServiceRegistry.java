package com.jsonloom.service.core.services;

import com.jsonloom.core.errors.InvalidConfigurationException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.extern.slf4j.Slf4j;

/** Explicit lookup of the {@link ResourceService} for each resource class. */
@Slf4j
public class ResourceServiceRegistry {
    private final List<ResourceService<?, ?>> services = new CopyOnWriteArrayList<>();

    public ResourceServiceRegistry register(ResourceService<?, ?> service) {
        Class<?> resourceClass = service.getResourceClass();
        if (find(resourceClass).isPresent()) {
            throw new InvalidConfigurationException(
                    "Multiple resource services registered for '" + resourceClass.getSimpleName() + "'.");
        }
        services.add(service);
        log.debug("Registered resource service {} for {}", service.getClass().getSimpleName(), resourceClass.getName());
        return this;
    }

    public Optional<ResourceService<?, ?>> find(Class<?> resourceClass) {
        for (ResourceService<?, ?> service : services) {
            if (service.getResourceClass().equals(resourceClass)) {
                return Optional.of(service);
            }
        }
        return Optional.empty();
    }

    public List<ResourceService<?, ?>> getServices() {
        return List.copyOf(services);
    }
}
