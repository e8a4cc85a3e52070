package com.jsonloom.core.resources;

import java.util.Collection;
import java.util.Optional;

/** Read-only registry of the resource types exposed by the API. Safe to share across threads. */
public interface ResourceGraph {

    Collection<ResourceContext> getResourceContexts();

    Optional<ResourceContext> findResourceContext(String publicName);

    Optional<ResourceContext> findResourceContext(Class<?> resourceClass);

    /**
     * @throws IllegalArgumentException when no resource type with that name is registered
     */
    default ResourceContext getResourceContext(String publicName) {
        return findResourceContext(publicName)
                .orElseThrow(() -> new IllegalArgumentException("Resource type '" + publicName + "' is not registered."));
    }

    /**
     * @throws IllegalArgumentException when the class is not registered
     */
    default ResourceContext getResourceContext(Class<?> resourceClass) {
        return findResourceContext(resourceClass)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Resource class '" + resourceClass.getName() + "' is not registered."));
    }
}
