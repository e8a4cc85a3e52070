package com.jsonloom.core.resources;

import java.lang.reflect.Field;
import java.util.Collection;
import java.util.List;

public final class HasOneAttribute extends RelationshipAttribute {

    public HasOneAttribute(String publicName, Field property, boolean canInclude) {
        super(publicName, property, property.getType(), canInclude);
    }

    @Override
    public boolean isToMany() {
        return false;
    }

    @Override
    public List<Identifiable<?>> getRightResources(Object resource) {
        Object value = getValue(resource);
        return value == null ? List.of() : List.of((Identifiable<?>) value);
    }

    @Override
    public void setRightResources(Object resource, Collection<? extends Identifiable<?>> rightResources) {
        if (rightResources.size() > 1) {
            throw new IllegalArgumentException("To-one relationship '" + getPublicName() + "' cannot hold multiple resources");
        }
        setValue(resource, rightResources.isEmpty() ? null : rightResources.iterator().next());
    }
}
