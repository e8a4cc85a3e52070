package com.jsonloom.service.core.hooks;

import com.jsonloom.core.resources.Identifiable;
import com.jsonloom.core.resources.ResourceContext;
import com.jsonloom.service.core.queries.expressions.IncludeExpression;
import java.util.Collection;
import java.util.List;

/** Used when resource hooks are disabled. */
public final class NoResourceHookExecutor implements ResourceHookExecutor {

    public static final NoResourceHookExecutor INSTANCE = new NoResourceHookExecutor();

    private NoResourceHookExecutor() {}

    @Override
    public void beforeRead(ResourceContext primaryType, ResourcePipeline pipeline, String stringId, IncludeExpression include) {}

    @Override
    public void afterRead(
            Collection<? extends Identifiable<?>> resources, ResourcePipeline pipeline, IncludeExpression include) {}

    @Override
    public <T extends Identifiable<?>> ReturnedResources<T> onReturn(
            List<T> resources, ResourcePipeline pipeline, IncludeExpression include) {
        return ReturnedResources.of(resources);
    }

    @Override
    public void beforeCreate(Collection<? extends Identifiable<?>> resources, ResourcePipeline pipeline) {}

    @Override
    public void afterCreate(Collection<? extends Identifiable<?>> resources, ResourcePipeline pipeline) {}

    @Override
    public void beforeUpdate(Collection<? extends Identifiable<?>> resources, ResourcePipeline pipeline) {}

    @Override
    public void afterUpdate(Collection<? extends Identifiable<?>> resources, ResourcePipeline pipeline) {}

    @Override
    public void beforeDelete(Collection<? extends Identifiable<?>> resources, ResourcePipeline pipeline) {}

    @Override
    public void afterDelete(Collection<? extends Identifiable<?>> resources, ResourcePipeline pipeline, boolean succeeded) {}
}
