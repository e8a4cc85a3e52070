package com.jsonloom.service.core.queries.parsing;

import com.jsonloom.core.resources.AttrAttribute;
import com.jsonloom.core.resources.RelationshipAttribute;
import com.jsonloom.core.resources.ResourceContext;
import com.jsonloom.core.resources.ResourceFieldAttribute;
import com.jsonloom.core.resources.annotations.AttrCapabilities;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiConsumer;

/** Resolves dotted field paths against the resource graph, validating their shape. */
public class ResourceFieldChainResolver {

    /** Resolves a chain of relationships ending in a to-many relationship, all of any cardinality. */
    public List<ResourceFieldAttribute> resolveToManyChain(ResourceContext resourceContext, String path) {
        List<ResourceFieldAttribute> chain = new ArrayList<>();
        String[] names = path.split("\\.", -1);
        ResourceContext current = resourceContext;
        for (int i = 0; i < names.length - 1; i++) {
            RelationshipAttribute relationship = getRelationship(names[i], current, path);
            chain.add(relationship);
            current = relationship.getRightType();
        }
        chain.add(getToManyRelationship(names[names.length - 1], current, path));
        return chain;
    }

    /** Resolves a chain of relationships of any cardinality, validating each one on the way. */
    public List<ResourceFieldAttribute> resolveRelationshipChain(
            ResourceContext resourceContext,
            String path,
            BiConsumer<RelationshipAttribute, ResourceContext> validateCallback) {
        List<ResourceFieldAttribute> chain = new ArrayList<>();
        ResourceContext current = resourceContext;
        for (String name : path.split("\\.", -1)) {
            RelationshipAttribute relationship = getRelationship(name, current, path);
            if (validateCallback != null) {
                validateCallback.accept(relationship, current);
            }
            chain.add(relationship);
            current = relationship.getRightType();
        }
        return chain;
    }

    /** Resolves to-one relationships followed by an attribute that must carry the capability, if given. */
    public List<ResourceFieldAttribute> resolveToOneChainEndingInAttribute(
            ResourceContext resourceContext, String path, AttrCapabilities requiredCapability) {
        List<ResourceFieldAttribute> chain = new ArrayList<>();
        String[] names = path.split("\\.", -1);
        ResourceContext current = resourceContext;
        for (int i = 0; i < names.length - 1; i++) {
            RelationshipAttribute relationship = getToOneRelationship(names[i], current, path);
            chain.add(relationship);
            current = relationship.getRightType();
        }
        AttrAttribute attribute = getAttribute(names[names.length - 1], current, path);
        if (requiredCapability != null && !attribute.hasCapability(requiredCapability)) {
            throw new QueryParseException(capabilityMessage(requiredCapability, attribute));
        }
        chain.add(attribute);
        return chain;
    }

    /** Resolves to-one relationships followed by either an attribute or a to-one relationship. */
    public List<ResourceFieldAttribute> resolveToOneChainEndingInAttributeOrToOne(
            ResourceContext resourceContext, String path, AttrCapabilities requiredCapability) {
        List<ResourceFieldAttribute> chain = new ArrayList<>();
        String[] names = path.split("\\.", -1);
        ResourceContext current = resourceContext;
        for (int i = 0; i < names.length - 1; i++) {
            RelationshipAttribute relationship = getToOneRelationship(names[i], current, path);
            chain.add(relationship);
            current = relationship.getRightType();
        }
        RelationshipAttribute toOne =
                current.findRelationship(names[names.length - 1]).orElse(null);
        if (toOne != null && !toOne.isToMany()) {
            chain.add(toOne);
            return chain;
        }
        return resolveToOneChainEndingInAttribute(resourceContext, path, requiredCapability);
    }

    /** Resolves to-one relationships followed by a to-many relationship. */
    public List<ResourceFieldAttribute> resolveToOneChainEndingInToMany(ResourceContext resourceContext, String path) {
        List<ResourceFieldAttribute> chain = new ArrayList<>();
        String[] names = path.split("\\.", -1);
        ResourceContext current = resourceContext;
        for (int i = 0; i < names.length - 1; i++) {
            RelationshipAttribute relationship = getToOneRelationship(names[i], current, path);
            chain.add(relationship);
            current = relationship.getRightType();
        }
        chain.add(getToManyRelationship(names[names.length - 1], current, path));
        return chain;
    }

    /** Resolves a single attribute or relationship name, as used in sparse fieldsets. */
    public ResourceFieldAttribute resolveSparseField(ResourceContext resourceContext, String name) {
        return resourceContext
                .findField(name)
                .orElseThrow(() -> new QueryParseException(
                        "Field '" + name + "' does not exist on resource '" + resourceContext.getPublicName() + "'."));
    }

    private static RelationshipAttribute getRelationship(String name, ResourceContext context, String path) {
        return context.findRelationship(name)
                .orElseThrow(() -> new QueryParseException(path.equals(name)
                        ? "Relationship '" + name + "' does not exist on resource '" + context.getPublicName() + "'."
                        : "Relationship '" + name + "' in '" + path + "' does not exist on resource '"
                                + context.getPublicName() + "'."));
    }

    private static RelationshipAttribute getToManyRelationship(String name, ResourceContext context, String path) {
        RelationshipAttribute relationship = getRelationship(name, context, path);
        if (!relationship.isToMany()) {
            throw new QueryParseException(path.equals(name)
                    ? "Relationship '" + name + "' must be a to-many relationship on resource '"
                            + context.getPublicName() + "'."
                    : "Relationship '" + name + "' in '" + path + "' must be a to-many relationship on resource '"
                            + context.getPublicName() + "'.");
        }
        return relationship;
    }

    private static RelationshipAttribute getToOneRelationship(String name, ResourceContext context, String path) {
        RelationshipAttribute relationship = getRelationship(name, context, path);
        if (relationship.isToMany()) {
            throw new QueryParseException(path.equals(name)
                    ? "Relationship '" + name + "' must be a to-one relationship on resource '"
                            + context.getPublicName() + "'."
                    : "Relationship '" + name + "' in '" + path + "' must be a to-one relationship on resource '"
                            + context.getPublicName() + "'.");
        }
        return relationship;
    }

    private static AttrAttribute getAttribute(String name, ResourceContext context, String path) {
        return context.findAttribute(name)
                .orElseThrow(() -> new QueryParseException(path.equals(name)
                        ? "Attribute '" + name + "' does not exist on resource '" + context.getPublicName() + "'."
                        : "Attribute '" + name + "' in '" + path + "' does not exist on resource '"
                                + context.getPublicName() + "'."));
    }

    private static String capabilityMessage(AttrCapabilities capability, AttrAttribute attribute) {
        return switch (capability) {
            case ALLOW_FILTER -> "Filtering on attribute '" + attribute.getPublicName() + "' is not allowed.";
            case ALLOW_SORT -> "Sorting on attribute '" + attribute.getPublicName() + "' is not allowed.";
            case ALLOW_VIEW -> "Retrieving the attribute '" + attribute.getPublicName() + "' is not allowed.";
            default -> "Attribute '" + attribute.getPublicName() + "' cannot be used here.";
        };
    }
}
