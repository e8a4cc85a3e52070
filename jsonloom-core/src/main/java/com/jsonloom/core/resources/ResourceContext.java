package com.jsonloom.core.resources;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Metadata of one resource type: its public name, backing class, identifier type and exposed
 * fields. Instances are created by {@link ResourceGraphBuilder} and never change afterwards.
 */
public final class ResourceContext {
    private final String publicName;
    private final Class<?> resourceClass;
    private final Class<?> identityClass;
    private final List<AttrAttribute> attributes;
    private final List<RelationshipAttribute> relationships;
    private final Map<String, ResourceFieldAttribute> fieldsByName;

    ResourceContext(
            String publicName,
            Class<?> resourceClass,
            Class<?> identityClass,
            List<AttrAttribute> attributes,
            List<RelationshipAttribute> relationships) {
        this.publicName = publicName;
        this.resourceClass = resourceClass;
        this.identityClass = identityClass;
        this.attributes = List.copyOf(attributes);
        this.relationships = List.copyOf(relationships);
        Map<String, ResourceFieldAttribute> fields = new LinkedHashMap<>();
        attributes.forEach(a -> fields.put(a.getPublicName(), a));
        relationships.forEach(r -> fields.put(r.getPublicName(), r));
        this.fieldsByName = Collections.unmodifiableMap(fields);
    }

    public String getPublicName() {
        return publicName;
    }

    public Class<?> getResourceClass() {
        return resourceClass;
    }

    public Class<?> getIdentityClass() {
        return identityClass;
    }

    public List<AttrAttribute> getAttributes() {
        return attributes;
    }

    public List<RelationshipAttribute> getRelationships() {
        return relationships;
    }

    public List<ResourceFieldAttribute> getFields() {
        return new ArrayList<>(fieldsByName.values());
    }

    public Optional<AttrAttribute> findAttribute(String name) {
        return fieldsByName.get(name) instanceof AttrAttribute attribute ? Optional.of(attribute) : Optional.empty();
    }

    public Optional<RelationshipAttribute> findRelationship(String name) {
        return fieldsByName.get(name) instanceof RelationshipAttribute relationship
                ? Optional.of(relationship)
                : Optional.empty();
    }

    public Optional<ResourceFieldAttribute> findField(String name) {
        return Optional.ofNullable(fieldsByName.get(name));
    }

    /**
     * Converts the textual form of an identifier to the identifier type.
     *
     * @throws IllegalArgumentException when the text is not a valid identifier of this type
     */
    public Object parseId(String stringId) {
        return RuntimeTypeConverter.convertType(stringId, identityClass);
    }

    public String getStringId(Identifiable<?> resource) {
        Object id = resource.getId();
        return id == null ? null : id.toString();
    }

    public void setStringId(Identifiable<?> resource, String stringId) {
        assignId(resource, stringId == null ? null : parseId(stringId));
    }

    @SuppressWarnings("unchecked")
    private static <ID> void assignId(Identifiable<ID> resource, Object id) {
        resource.setId((ID) id);
    }

    /** Instantiates the resource class through its no-argument constructor. */
    public Identifiable<?> createInstance() {
        try {
            Constructor<?> constructor = resourceClass.getDeclaredConstructor();
            constructor.setAccessible(true);
            return (Identifiable<?>) constructor.newInstance();
        } catch (NoSuchMethodException | InstantiationException | IllegalAccessException e) {
            throw new IllegalStateException(
                    "Resource class '" + resourceClass.getName() + "' requires an accessible no-argument constructor", e);
        } catch (InvocationTargetException e) {
            throw new IllegalStateException(
                    "Constructor of resource class '" + resourceClass.getName() + "' failed", e.getCause());
        }
    }

    @Override
    public String toString() {
        return publicName;
    }
}
