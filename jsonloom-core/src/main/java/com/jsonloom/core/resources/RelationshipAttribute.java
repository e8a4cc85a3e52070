package com.jsonloom.core.resources;

import java.lang.reflect.Field;
import java.util.Collection;
import java.util.List;

/**
 * A navigation from a left resource type to a right resource type. The right type is resolved once
 * the whole graph is known.
 */
public abstract class RelationshipAttribute extends ResourceFieldAttribute {
    private final Class<?> rightClass;
    private final boolean canInclude;
    private ResourceContext leftType;
    private ResourceContext rightType;

    protected RelationshipAttribute(String publicName, Field property, Class<?> rightClass, boolean canInclude) {
        super(publicName, property);
        this.rightClass = rightClass;
        this.canInclude = canInclude;
    }

    public Class<?> getRightClass() {
        return rightClass;
    }

    public boolean canInclude() {
        return canInclude;
    }

    public ResourceContext getLeftType() {
        return leftType;
    }

    public ResourceContext getRightType() {
        return rightType;
    }

    void bind(ResourceContext leftType, ResourceContext rightType) {
        if (this.rightType != null) {
            throw new IllegalStateException("Relationship '" + getPublicName() + "' is already bound");
        }
        this.leftType = leftType;
        this.rightType = rightType;
    }

    public abstract boolean isToMany();

    /** Returns the related resources as a list, regardless of cardinality. Never null. */
    public abstract List<Identifiable<?>> getRightResources(Object resource);

    /** Assigns a collection of related resources, converting to the field's shape. */
    public abstract void setRightResources(Object resource, Collection<? extends Identifiable<?>> rightResources);
}
