package com.jsonloom.service.core.hooks;

import com.jsonloom.core.resources.Identifiable;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle callbacks for one resource type. Subclasses override the callbacks they need and list
 * them in the constructor; only listed hooks are invoked.
 *
 * <pre>{@code
 * public class ArticleHooks extends ResourceHooksDefinition<Article> {
 *     public ArticleHooks() {
 *         super(Article.class, ResourceHook.AFTER_READ);
 *     }
 *
 *     @Override
 *     public void afterRead(Set<Article> articles, ResourcePipeline pipeline, boolean isIncluded) {
 *         articles.forEach(Article::markViewed);
 *     }
 * }
 * }</pre>
 *
 * @param <T> resource class
 */
public abstract class ResourceHooksDefinition<T extends Identifiable<?>> {
    private final Class<T> resourceClass;
    private final Set<ResourceHook> implementedHooks;

    protected ResourceHooksDefinition(Class<T> resourceClass, ResourceHook... implementedHooks) {
        this.resourceClass = resourceClass;
        EnumSet<ResourceHook> hooks = EnumSet.noneOf(ResourceHook.class);
        Collections.addAll(hooks, implementedHooks);
        this.implementedHooks = Collections.unmodifiableSet(hooks);
    }

    public Class<T> getResourceClass() {
        return resourceClass;
    }

    public Set<ResourceHook> getImplementedHooks() {
        return implementedHooks;
    }

    public boolean implementsHook(ResourceHook hook) {
        return implementedHooks.contains(hook);
    }

    /**
     * Called before resources are fetched.
     *
     * @param isIncluded true when the type is fetched through {@code include}
     * @param stringId the requested identifier for single-resource reads, otherwise null
     */
    public void beforeRead(ResourcePipeline pipeline, boolean isIncluded, String stringId) {}

    /** Called once per type with all fetched instances of that type. */
    public void afterRead(Set<T> resources, ResourcePipeline pipeline, boolean isIncluded) {}

    /** Returns the instances that may be sent to the client. */
    public Set<T> onReturn(Set<T> resources, ResourcePipeline pipeline) {
        return resources;
    }

    public void beforeCreate(Set<T> resources, ResourcePipeline pipeline) {}

    public void afterCreate(Set<T> resources, ResourcePipeline pipeline) {}

    public void beforeUpdate(Set<T> resources, ResourcePipeline pipeline) {}

    public void afterUpdate(Set<T> resources, ResourcePipeline pipeline) {}

    public void beforeDelete(Set<T> resources, ResourcePipeline pipeline) {}

    public void afterDelete(Set<T> resources, ResourcePipeline pipeline, boolean succeeded) {}
}
