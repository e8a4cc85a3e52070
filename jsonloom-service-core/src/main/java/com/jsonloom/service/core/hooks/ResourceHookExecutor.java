package com.jsonloom.service.core.hooks;

import com.jsonloom.core.resources.Identifiable;
import com.jsonloom.core.resources.ResourceContext;
import com.jsonloom.service.core.queries.expressions.IncludeExpression;
import java.util.Collection;
import java.util.List;

/** Invokes resource hooks from the service layer. */
public interface ResourceHookExecutor {

    /** Runs {@code beforeRead} for the primary type and for each type on the include tree. */
    void beforeRead(ResourceContext primaryType, ResourcePipeline pipeline, String stringId, IncludeExpression include);

    /** Runs {@code afterRead} for the primary type and every type reached through the include tree. */
    void afterRead(
            Collection<? extends Identifiable<?>> resources, ResourcePipeline pipeline, IncludeExpression include);

    /**
     * Runs {@code onReturn} for the primary type and every type reached through the include tree.
     * The resources themselves are not modified.
     */
    <T extends Identifiable<?>> ReturnedResources<T> onReturn(
            List<T> resources, ResourcePipeline pipeline, IncludeExpression include);

    void beforeCreate(Collection<? extends Identifiable<?>> resources, ResourcePipeline pipeline);

    void afterCreate(Collection<? extends Identifiable<?>> resources, ResourcePipeline pipeline);

    void beforeUpdate(Collection<? extends Identifiable<?>> resources, ResourcePipeline pipeline);

    void afterUpdate(Collection<? extends Identifiable<?>> resources, ResourcePipeline pipeline);

    void beforeDelete(Collection<? extends Identifiable<?>> resources, ResourcePipeline pipeline);

    void afterDelete(Collection<? extends Identifiable<?>> resources, ResourcePipeline pipeline, boolean succeeded);
}
