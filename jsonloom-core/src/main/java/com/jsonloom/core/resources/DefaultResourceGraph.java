package com.jsonloom.core.resources;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

final class DefaultResourceGraph implements ResourceGraph {
    private final Map<String, ResourceContext> byName;
    private final Map<Class<?>, ResourceContext> byClass;

    DefaultResourceGraph(List<ResourceContext> contexts) {
        Map<String, ResourceContext> names = new LinkedHashMap<>();
        Map<Class<?>, ResourceContext> classes = new LinkedHashMap<>();
        for (ResourceContext context : contexts) {
            names.put(context.getPublicName(), context);
            classes.put(context.getResourceClass(), context);
        }
        this.byName = Collections.unmodifiableMap(names);
        this.byClass = Collections.unmodifiableMap(classes);
    }

    @Override
    public Collection<ResourceContext> getResourceContexts() {
        return byName.values();
    }

    @Override
    public Optional<ResourceContext> findResourceContext(String publicName) {
        return Optional.ofNullable(byName.get(publicName));
    }

    @Override
    public Optional<ResourceContext> findResourceContext(Class<?> resourceClass) {
        ResourceContext context = byClass.get(resourceClass);
        if (context == null && resourceClass != null) {
            // proxies and subclasses resolve to the nearest registered superclass
            for (Class<?> type = resourceClass.getSuperclass(); type != null && context == null; type = type.getSuperclass()) {
                context = byClass.get(type);
            }
        }
        return Optional.ofNullable(context);
    }
}
