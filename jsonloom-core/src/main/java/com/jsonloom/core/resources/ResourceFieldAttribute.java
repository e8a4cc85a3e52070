package com.jsonloom.core.resources;

import java.lang.reflect.Field;

/** Common base of attributes and relationships: a public name bound to a field of the resource class. */
public abstract class ResourceFieldAttribute {
    private final String publicName;
    private final Field property;

    protected ResourceFieldAttribute(String publicName, Field property) {
        this.publicName = publicName;
        this.property = property;
        this.property.setAccessible(true);
    }

    public String getPublicName() {
        return publicName;
    }

    public Field getProperty() {
        return property;
    }

    public Class<?> getPropertyType() {
        return property.getType();
    }

    public Object getValue(Object resource) {
        try {
            return property.get(resource);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot read field '" + property.getName() + "'", e);
        }
    }

    public void setValue(Object resource, Object value) {
        try {
            property.set(resource, value);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot write field '" + property.getName() + "'", e);
        }
    }

    @Override
    public String toString() {
        return publicName;
    }
}
