package com.jsonloom.service.core.hooks;

import com.jsonloom.core.errors.InvalidConfigurationException;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;

/** One {@link ResourceHooksDefinition} per resource class, registered explicitly at startup. */
@Slf4j
public class ResourceHooksRegistry {
    private final Map<Class<?>, ResourceHooksDefinition<?>> definitions = new ConcurrentHashMap<>();

    public ResourceHooksRegistry register(ResourceHooksDefinition<?> definition) {
        ResourceHooksDefinition<?> existing = definitions.putIfAbsent(definition.getResourceClass(), definition);
        if (existing != null) {
            throw new InvalidConfigurationException("Cannot define multiple ResourceHooksDefinition implementations for '"
                    + definition.getResourceClass().getSimpleName() + "'.");
        }
        log.debug(
                "Registered {} for {} with hooks {}",
                definition.getClass().getSimpleName(),
                definition.getResourceClass().getSimpleName(),
                definition.getImplementedHooks());
        return this;
    }

    public Optional<ResourceHooksDefinition<?>> find(Class<?> resourceClass) {
        return Optional.ofNullable(definitions.get(resourceClass));
    }

    /** The definition for the class, only when it implements the hook. */
    public Optional<ResourceHooksDefinition<?>> find(Class<?> resourceClass, ResourceHook hook) {
        return find(resourceClass).filter(definition -> definition.implementsHook(hook));
    }

    public Collection<ResourceHooksDefinition<?>> getDefinitions() {
        return Collections.unmodifiableCollection(definitions.values());
    }
}
