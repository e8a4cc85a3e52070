package com.jsonloom.core.resources;

import java.lang.reflect.Field;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class HasManyAttribute extends RelationshipAttribute {

    public HasManyAttribute(String publicName, Field property, boolean canInclude) {
        super(publicName, property, elementType(property), canInclude);
        if (!Collection.class.isAssignableFrom(property.getType())) {
            throw new IllegalArgumentException(
                    "To-many relationship '" + publicName + "' must be declared as a collection");
        }
    }

    @Override
    public boolean isToMany() {
        return true;
    }

    @Override
    public List<Identifiable<?>> getRightResources(Object resource) {
        Object value = getValue(resource);
        if (value == null) {
            return List.of();
        }
        List<Identifiable<?>> resources = new ArrayList<>();
        for (Object element : (Collection<?>) value) {
            resources.add((Identifiable<?>) element);
        }
        return resources;
    }

    @Override
    public void setRightResources(Object resource, Collection<? extends Identifiable<?>> rightResources) {
        setValue(resource, createCollection(rightResources));
    }

    /** Creates a collection matching the declared field type ({@code Set} or {@code List}). */
    public Collection<Identifiable<?>> createCollection(Collection<? extends Identifiable<?>> items) {
        if (Set.class.isAssignableFrom(getPropertyType())) {
            return new LinkedHashSet<>(items);
        }
        return new ArrayList<>(items);
    }

    private static Class<?> elementType(Field property) {
        Type generic = property.getGenericType();
        if (generic instanceof ParameterizedType parameterized
                && parameterized.getActualTypeArguments().length == 1
                && parameterized.getActualTypeArguments()[0] instanceof Class<?> element) {
            return element;
        }
        throw new IllegalArgumentException(
                "Cannot determine element type of to-many field '" + property.getName() + "'");
    }
}
