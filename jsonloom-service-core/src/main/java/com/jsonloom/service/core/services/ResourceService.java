package com.jsonloom.service.core.services;

import com.jsonloom.core.resources.Identifiable;
import com.jsonloom.service.core.hooks.ReturnedResources;
import com.jsonloom.service.core.queries.QuerySpecification;
import com.jsonloom.service.core.request.TargetedFields;
import java.util.Set;

/**
 * Entry point for reading and writing resources of one type. Implementations run resource hooks
 * around the underlying {@link ResourceRepository}.
 *
 * @param <T> resource type
 * @param <ID> identifier type
 */
public interface ResourceService<T extends Identifiable<ID>, ID> {

    Class<T> getResourceClass();

    /** The visible resources, plus the resources that hooks hid from the response. */
    ReturnedResources<T> getAll(QuerySpecification query);

    /**
     * Returns the requested resource as the single visible entry.
     *
     * @throws com.jsonloom.core.errors.ResourceNotFoundException when no resource has the given ID
     */
    ReturnedResources<T> getById(ID id, QuerySpecification query);

    /**
     * Returns the value of a relationship of the given resource: a resource, a collection of
     * resources or null.
     *
     * @throws com.jsonloom.core.errors.RelationshipNotFoundException for an unknown relationship
     */
    Object getRelationship(ID id, String relationshipName);

    /** Returns the created resource, or null when it is stored exactly as sent. */
    T create(T resource, TargetedFields targetedFields);

    /** Returns the updated resource, or null when it is stored exactly as sent. */
    T update(ID id, T resource, TargetedFields targetedFields);

    void delete(ID id);

    /** Replaces a relationship. The right value is a single resource, null, or a set of resources. */
    void setRelationship(ID primaryId, String relationshipName, Object rightValue);

    void addToToManyRelationship(ID primaryId, String relationshipName, Set<Identifiable<?>> rightResources);

    void removeFromToManyRelationship(ID primaryId, String relationshipName, Set<Identifiable<?>> rightResources);
}
