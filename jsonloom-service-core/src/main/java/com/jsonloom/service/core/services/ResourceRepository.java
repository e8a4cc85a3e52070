package com.jsonloom.service.core.services;

import com.jsonloom.core.resources.HasManyAttribute;
import com.jsonloom.core.resources.Identifiable;
import com.jsonloom.core.resources.RelationshipAttribute;
import com.jsonloom.service.core.queries.QuerySpecification;
import com.jsonloom.service.core.request.TargetedFields;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/** Persistence for one resource type. Applications supply one per registered type. */
public interface ResourceRepository<T extends Identifiable<ID>, ID> {

    Class<T> getResourceClass();

    /** Applies filter, sort and pagination of the query and loads included relationships. */
    List<T> getAll(QuerySpecification query);

    Optional<T> findById(ID id);

    T create(T resource, TargetedFields targetedFields);

    /** Copies the targeted fields of {@code changes} onto {@code existing} and stores the result. */
    T update(T existing, T changes, TargetedFields targetedFields);

    /** @return false when nothing was deleted */
    boolean delete(ID id);

    void setRelationship(T primary, RelationshipAttribute relationship, Object rightValue);

    void addToToManyRelationship(T primary, HasManyAttribute relationship, Set<Identifiable<?>> rightResources);

    void removeFromToManyRelationship(
            T primary, HasManyAttribute relationship, Set<Identifiable<?>> rightResources);
}
