package com.jsonloom.service.core.hooks;

import com.jsonloom.core.resources.Identifiable;
import com.jsonloom.core.resources.RelationshipAttribute;
import com.jsonloom.core.resources.ResourceContext;
import com.jsonloom.core.resources.ResourceGraph;
import com.jsonloom.core.resources.ResourceIdentity;
import com.jsonloom.service.core.hooks.traversal.ResourceTreeTraversal;
import com.jsonloom.service.core.hooks.traversal.TraversalResult;
import com.jsonloom.service.core.queries.expressions.IncludeExpression;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Executes hooks from the {@link ResourceHooksRegistry}. Read hooks walk the include tree of the
 * request and call each type once with all of its instances; the root type is reported as not
 * included, every other type as included. Write hooks only see the primary resources.
 */
@Slf4j
public class DefaultResourceHookExecutor implements ResourceHookExecutor {
    private final ResourceHooksRegistry hooksRegistry;
    private final ResourceGraph resourceGraph;
    private final ResourceTreeTraversal traversal;

    public DefaultResourceHookExecutor(ResourceHooksRegistry hooksRegistry, ResourceGraph resourceGraph) {
        this.hooksRegistry = hooksRegistry;
        this.resourceGraph = resourceGraph;
        this.traversal = new ResourceTreeTraversal(resourceGraph);
    }

    @Override
    public void beforeRead(
            ResourceContext primaryType, ResourcePipeline pipeline, String stringId, IncludeExpression include) {
        Set<ResourceContext> invoked = new HashSet<>();
        invoked.add(primaryType);
        hooksRegistry.find(primaryType.getResourceClass(), ResourceHook.BEFORE_READ).ifPresent(definition -> {
            log.debug("Invoking beforeRead hook for '{}' ({})", primaryType, pipeline);
            definition.beforeRead(pipeline, false, stringId);
        });

        for (List<RelationshipAttribute> chain : include.toChains()) {
            for (RelationshipAttribute relationship : chain) {
                ResourceContext includedType = relationship.getRightType();
                if (invoked.add(includedType)) {
                    hooksRegistry
                            .find(includedType.getResourceClass(), ResourceHook.BEFORE_READ)
                            .ifPresent(definition -> {
                                log.debug("Invoking beforeRead hook for included '{}' ({})", includedType, pipeline);
                                definition.beforeRead(pipeline, true, null);
                            });
                }
            }
        }
    }

    @Override
    public void afterRead(
            Collection<? extends Identifiable<?>> resources, ResourcePipeline pipeline, IncludeExpression include) {
        if (resources.isEmpty()) {
            return;
        }
        TraversalResult tree = traversal.traverse(resources, include);
        for (Map.Entry<ResourceContext, Set<Identifiable<?>>> entry : tree.resourcesByType().entrySet()) {
            ResourceContext type = entry.getKey();
            boolean isIncluded = type != tree.rootType();
            hooksRegistry.find(type.getResourceClass(), ResourceHook.AFTER_READ).ifPresent(definition -> {
                log.debug(
                        "Invoking afterRead hook for {} '{}' resources (included: {})",
                        entry.getValue().size(),
                        type,
                        isIncluded);
                asRaw(definition).afterRead(new LinkedHashSet<>(entry.getValue()), pipeline, isIncluded);
            });
        }
    }

    @Override
    public <T extends Identifiable<?>> ReturnedResources<T> onReturn(
            List<T> resources, ResourcePipeline pipeline, IncludeExpression include) {
        if (resources.isEmpty()) {
            return ReturnedResources.of(resources);
        }
        TraversalResult tree = traversal.traverse(resources, include);

        Set<ResourceIdentity> hidden = new HashSet<>();
        for (Map.Entry<ResourceContext, Set<Identifiable<?>>> entry : tree.resourcesByType().entrySet()) {
            Optional<ResourceHooksDefinition<?>> definition =
                    hooksRegistry.find(entry.getKey().getResourceClass(), ResourceHook.ON_RETURN);
            if (definition.isEmpty()) {
                continue;
            }
            log.debug("Invoking onReturn hook for {} '{}' resources", entry.getValue().size(), entry.getKey());
            Set<Identifiable<?>> kept = asRaw(definition.get()).onReturn(new LinkedHashSet<>(entry.getValue()), pipeline);
            Set<ResourceIdentity> keptIdentities = identities(kept);
            for (Identifiable<?> resource : entry.getValue()) {
                ResourceIdentity identity = ResourceIdentity.of(resource);
                if (!keptIdentities.contains(identity)) {
                    hidden.add(identity);
                }
            }
        }

        if (hidden.isEmpty()) {
            return ReturnedResources.of(resources);
        }
        List<T> visible = new ArrayList<>();
        for (T resource : resources) {
            if (!hidden.contains(ResourceIdentity.of(resource))) {
                visible.add(resource);
            }
        }
        return new ReturnedResources<>(visible, hidden);
    }

    @Override
    public void beforeCreate(Collection<? extends Identifiable<?>> resources, ResourcePipeline pipeline) {
        findWriteHook(resources, ResourceHook.BEFORE_CREATE)
                .ifPresent(definition -> definition.beforeCreate(new LinkedHashSet<>(resources), pipeline));
    }

    @Override
    public void afterCreate(Collection<? extends Identifiable<?>> resources, ResourcePipeline pipeline) {
        findWriteHook(resources, ResourceHook.AFTER_CREATE)
                .ifPresent(definition -> definition.afterCreate(new LinkedHashSet<>(resources), pipeline));
    }

    @Override
    public void beforeUpdate(Collection<? extends Identifiable<?>> resources, ResourcePipeline pipeline) {
        findWriteHook(resources, ResourceHook.BEFORE_UPDATE)
                .ifPresent(definition -> definition.beforeUpdate(new LinkedHashSet<>(resources), pipeline));
    }

    @Override
    public void afterUpdate(Collection<? extends Identifiable<?>> resources, ResourcePipeline pipeline) {
        findWriteHook(resources, ResourceHook.AFTER_UPDATE)
                .ifPresent(definition -> definition.afterUpdate(new LinkedHashSet<>(resources), pipeline));
    }

    @Override
    public void beforeDelete(Collection<? extends Identifiable<?>> resources, ResourcePipeline pipeline) {
        findWriteHook(resources, ResourceHook.BEFORE_DELETE)
                .ifPresent(definition -> definition.beforeDelete(new LinkedHashSet<>(resources), pipeline));
    }

    @Override
    public void afterDelete(
            Collection<? extends Identifiable<?>> resources, ResourcePipeline pipeline, boolean succeeded) {
        findWriteHook(resources, ResourceHook.AFTER_DELETE)
                .ifPresent(definition -> definition.afterDelete(new LinkedHashSet<>(resources), pipeline, succeeded));
    }

    private Optional<ResourceHooksDefinition<Identifiable<?>>> findWriteHook(
            Collection<? extends Identifiable<?>> resources, ResourceHook hook) {
        if (resources.isEmpty()) {
            return Optional.empty();
        }
        ResourceContext type = resourceGraph.getResourceContext(resources.iterator().next().getClass());
        Optional<ResourceHooksDefinition<Identifiable<?>>> definition =
                hooksRegistry.find(type.getResourceClass(), hook).map(DefaultResourceHookExecutor::asRaw);
        definition.ifPresent(d -> log.debug("Invoking {} hook for {} '{}' resources", hook, resources.size(), type));
        return definition;
    }

    private static Set<ResourceIdentity> identities(Collection<? extends Identifiable<?>> resources) {
        Set<ResourceIdentity> identities = new HashSet<>();
        if (resources != null) {
            resources.forEach(resource -> identities.add(ResourceIdentity.of(resource)));
        }
        return identities;
    }

    @SuppressWarnings("unchecked")
    private static ResourceHooksDefinition<Identifiable<?>> asRaw(ResourceHooksDefinition<?> definition) {
        return (ResourceHooksDefinition<Identifiable<?>>) definition;
    }
}
