package com.jsonloom.service.core.services;

import com.jsonloom.core.errors.RelationshipNotFoundException;
import com.jsonloom.core.errors.ResourceNotFoundException;
import com.jsonloom.core.resources.HasManyAttribute;
import com.jsonloom.core.resources.Identifiable;
import com.jsonloom.core.resources.RelationshipAttribute;
import com.jsonloom.core.resources.ResourceContext;
import com.jsonloom.core.resources.ResourceGraph;
import com.jsonloom.service.core.hooks.ResourceHookExecutor;
import com.jsonloom.service.core.hooks.ResourcePipeline;
import com.jsonloom.service.core.hooks.ReturnedResources;
import com.jsonloom.service.core.queries.QuerySpecification;
import com.jsonloom.service.core.queries.expressions.IncludeExpression;
import com.jsonloom.service.core.request.TargetedFields;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Default {@link ResourceService}: resolves resources through the repository and runs resource
 * hooks around every read and write. Read hooks cover the primary type and the include tree of the
 * request; resources filtered by {@code onReturn} are reported, never removed from the fetched
 * instances.
 */
@Slf4j
public class JsonApiResourceService<T extends Identifiable<ID>, ID> implements ResourceService<T, ID> {
    private final ResourceRepository<T, ID> repository;
    private final ResourceContext resourceContext;
    private final ResourceHookExecutor hookExecutor;

    public JsonApiResourceService(
            ResourceRepository<T, ID> repository, ResourceGraph resourceGraph, ResourceHookExecutor hookExecutor) {
        this.repository = repository;
        this.resourceContext = resourceGraph.getResourceContext(repository.getResourceClass());
        this.hookExecutor = hookExecutor;
    }

    @Override
    public Class<T> getResourceClass() {
        return repository.getResourceClass();
    }

    @Override
    public ReturnedResources<T> getAll(QuerySpecification query) {
        log.debug("Entering getAll for '{}'", resourceContext.getPublicName());
        IncludeExpression include = query.getInclude();
        hookExecutor.beforeRead(resourceContext, ResourcePipeline.GET, null, include);

        List<T> resources = repository.getAll(query);

        hookExecutor.afterRead(resources, ResourcePipeline.GET, include);
        return hookExecutor.onReturn(resources, ResourcePipeline.GET, include);
    }

    @Override
    public ReturnedResources<T> getById(ID id, QuerySpecification query) {
        log.debug("Entering getById for '{}' with ID '{}'", resourceContext.getPublicName(), id);
        IncludeExpression include = query.getInclude();
        hookExecutor.beforeRead(resourceContext, ResourcePipeline.GET_SINGLE, String.valueOf(id), include);

        T resource = getPrimaryResourceById(id);

        hookExecutor.afterRead(List.of(resource), ResourcePipeline.GET_SINGLE, include);
        ReturnedResources<T> returned = hookExecutor.onReturn(List.of(resource), ResourcePipeline.GET_SINGLE, include);
        if (returned.isEmpty()) {
            throw new ResourceNotFoundException(String.valueOf(id), resourceContext.getPublicName());
        }
        return returned;
    }

    @Override
    public Object getRelationship(ID id, String relationshipName) {
        RelationshipAttribute relationship = getRelationshipOrThrow(relationshipName);
        IncludeExpression include = IncludeExpression.fromChains(List.of(List.of(relationship)));
        hookExecutor.beforeRead(resourceContext, ResourcePipeline.GET_RELATIONSHIP, String.valueOf(id), include);

        T primary = getPrimaryResourceById(id);

        hookExecutor.afterRead(List.of(primary), ResourcePipeline.GET_RELATIONSHIP, include);
        ReturnedResources<T> returned =
                hookExecutor.onReturn(List.of(primary), ResourcePipeline.GET_RELATIONSHIP, include);
        if (returned.isEmpty()) {
            throw new ResourceNotFoundException(String.valueOf(id), resourceContext.getPublicName());
        }
        return withoutHidden(relationship.getValue(primary), returned);
    }

    @Override
    public T create(T resource, TargetedFields targetedFields) {
        log.debug("Entering create for '{}'", resourceContext.getPublicName());
        hookExecutor.beforeCreate(List.of(resource), ResourcePipeline.POST);

        T created = repository.create(resource, targetedFields);

        hookExecutor.afterCreate(List.of(created), ResourcePipeline.POST);
        return created;
    }

    @Override
    public T update(ID id, T resource, TargetedFields targetedFields) {
        log.debug("Entering update for '{}' with ID '{}'", resourceContext.getPublicName(), id);
        T existing = getPrimaryResourceById(id);
        hookExecutor.beforeUpdate(List.of(resource), ResourcePipeline.PATCH);

        T updated = repository.update(existing, resource, targetedFields);

        hookExecutor.afterUpdate(List.of(updated), ResourcePipeline.PATCH);
        return updated;
    }

    @Override
    public void delete(ID id) {
        log.debug("Entering delete for '{}' with ID '{}'", resourceContext.getPublicName(), id);
        T existing = getPrimaryResourceById(id);
        hookExecutor.beforeDelete(List.of(existing), ResourcePipeline.DELETE);

        boolean succeeded = repository.delete(id);

        hookExecutor.afterDelete(List.of(existing), ResourcePipeline.DELETE, succeeded);
        if (!succeeded) {
            throw new ResourceNotFoundException(String.valueOf(id), resourceContext.getPublicName());
        }
    }

    @Override
    public void setRelationship(ID primaryId, String relationshipName, Object rightValue) {
        RelationshipAttribute relationship = getRelationshipOrThrow(relationshipName);
        T primary = getPrimaryResourceById(primaryId);
        hookExecutor.beforeUpdate(List.of(primary), ResourcePipeline.PATCH_RELATIONSHIP);

        repository.setRelationship(primary, relationship, rightValue);

        hookExecutor.afterUpdate(List.of(primary), ResourcePipeline.PATCH_RELATIONSHIP);
    }

    @Override
    public void addToToManyRelationship(ID primaryId, String relationshipName, Set<Identifiable<?>> rightResources) {
        HasManyAttribute relationship = getToManyRelationshipOrThrow(relationshipName);
        T primary = getPrimaryResourceById(primaryId);
        hookExecutor.beforeUpdate(List.of(primary), ResourcePipeline.PATCH_RELATIONSHIP);

        repository.addToToManyRelationship(primary, relationship, rightResources);

        hookExecutor.afterUpdate(List.of(primary), ResourcePipeline.PATCH_RELATIONSHIP);
    }

    @Override
    public void removeFromToManyRelationship(
            ID primaryId, String relationshipName, Set<Identifiable<?>> rightResources) {
        HasManyAttribute relationship = getToManyRelationshipOrThrow(relationshipName);
        T primary = getPrimaryResourceById(primaryId);
        hookExecutor.beforeUpdate(List.of(primary), ResourcePipeline.PATCH_RELATIONSHIP);

        repository.removeFromToManyRelationship(primary, relationship, rightResources);

        hookExecutor.afterUpdate(List.of(primary), ResourcePipeline.PATCH_RELATIONSHIP);
    }

    /** The relationship value minus hidden resources, as a new collection when anything was dropped. */
    private static Object withoutHidden(Object value, ReturnedResources<?> returned) {
        if (returned.hidden().isEmpty() || value == null) {
            return value;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> visible = new ArrayList<>();
            for (Object element : collection) {
                if (!(element instanceof Identifiable<?> resource && returned.isHidden(resource))) {
                    visible.add(element);
                }
            }
            return visible;
        }
        return value instanceof Identifiable<?> resource && returned.isHidden(resource) ? null : value;
    }

    private T getPrimaryResourceById(ID id) {
        return repository
                .findById(id)
                .orElseThrow(() -> new ResourceNotFoundException(String.valueOf(id), resourceContext.getPublicName()));
    }

    private RelationshipAttribute getRelationshipOrThrow(String relationshipName) {
        return resourceContext
                .findRelationship(relationshipName)
                .orElseThrow(() -> new RelationshipNotFoundException(relationshipName, resourceContext.getPublicName()));
    }

    private HasManyAttribute getToManyRelationshipOrThrow(String relationshipName) {
        if (getRelationshipOrThrow(relationshipName) instanceof HasManyAttribute hasMany) {
            return hasMany;
        }
        throw new RelationshipNotFoundException(relationshipName, resourceContext.getPublicName());
    }
}
