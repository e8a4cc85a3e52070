package com.jsonloom.controller.rest.serialization;

import com.jsonloom.api.dto.Document;
import com.jsonloom.api.dto.RelationshipObject;
import com.jsonloom.api.dto.ResourceIdentifierObject;
import com.jsonloom.api.dto.ResourceObject;
import com.jsonloom.core.resources.AttrAttribute;
import com.jsonloom.core.resources.Identifiable;
import com.jsonloom.core.resources.RelationshipAttribute;
import com.jsonloom.core.resources.ResourceContext;
import com.jsonloom.core.resources.ResourceGraph;
import com.jsonloom.core.resources.ResourceIdentity;
import com.jsonloom.core.resources.RuntimeTypeConverter;
import com.jsonloom.core.resources.annotations.AttrCapabilities;
import com.jsonloom.service.core.hooks.ReturnedResources;
import com.jsonloom.service.core.queries.QuerySpecification;
import com.jsonloom.service.core.queries.expressions.IncludeElementExpression;
import com.jsonloom.service.core.queries.expressions.SparseFieldSetExpression;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps resource instances to response documents, honouring sparse fieldsets, the include tree and
 * the null/default value handling of the request. Resources hidden by {@code onReturn} hooks are
 * left out of relationship data and {@code included}.
 */
public class ResourceObjectBuilder {
    private static final ReturnedResources<Identifiable<?>> NOTHING_HIDDEN = ReturnedResources.of(List.of());

    private final ResourceGraph resourceGraph;

    public ResourceObjectBuilder(ResourceGraph resourceGraph) {
        this.resourceGraph = resourceGraph;
    }

    public Document buildCollection(ReturnedResources<?> returned, QuerySpecification query) {
        return buildCollection(returned.resources(), query, returned);
    }

    public Document buildCollection(Collection<? extends Identifiable<?>> resources, QuerySpecification query) {
        return buildCollection(resources, query, NOTHING_HIDDEN);
    }

    /** Document for a single resource; an empty result is written as {@code "data": null}. */
    public Document buildSingle(ReturnedResources<?> returned, QuerySpecification query) {
        Identifiable<?> resource = returned.isEmpty() ? null : returned.resources().get(0);
        Map<ResourceIdentity, ResourceObject> included = new LinkedHashMap<>();
        ResourceObject data = resource == null ? null : build(resource, query, returned);
        if (resource != null) {
            collectIncluded(resource, query.getInclude().elements(), query, returned, included);
            included.remove(ResourceIdentity.of(resource));
        }
        return document(data, included);
    }

    public Document buildSingle(Identifiable<?> resource, QuerySpecification query) {
        List<Identifiable<?>> resources = resource == null ? List.of() : List.of(resource);
        return buildSingle(ReturnedResources.of(resources), query);
    }

    /** Document for a relationship endpoint: identifiers only. */
    public Document buildRelationship(RelationshipAttribute relationship, Object value) {
        Document document = new Document();
        document.setData(identifiers(relationship, value, NOTHING_HIDDEN));
        return document;
    }

    public ResourceObject build(Identifiable<?> resource, QuerySpecification query) {
        return build(resource, query, NOTHING_HIDDEN);
    }

    private Document buildCollection(
            Collection<? extends Identifiable<?>> resources, QuerySpecification query, ReturnedResources<?> returned) {
        Map<ResourceIdentity, ResourceObject> included = new LinkedHashMap<>();
        List<ResourceObject> data = new ArrayList<>();
        for (Identifiable<?> resource : resources) {
            data.add(build(resource, query, returned));
        }
        for (Identifiable<?> resource : resources) {
            collectIncluded(resource, query.getInclude().elements(), query, returned, included);
        }
        resources.forEach(r -> included.remove(ResourceIdentity.of(r)));
        return document(data, included);
    }

    private ResourceObject build(Identifiable<?> resource, QuerySpecification query, ReturnedResources<?> returned) {
        ResourceContext resourceContext = resourceGraph.getResourceContext(resource.getClass());
        Optional<SparseFieldSetExpression> fieldSet = query.getSparseFieldSet(resourceContext);

        ResourceObject object = new ResourceObject();
        object.setType(resourceContext.getPublicName());
        object.setId(resourceContext.getStringId(resource));
        if (object.getId() == null) {
            object.setLid(resource.getLocalId());
        }

        for (AttrAttribute attribute : resourceContext.getAttributes()) {
            if (!attribute.hasCapability(AttrCapabilities.ALLOW_VIEW)
                    || fieldSet.map(set -> !set.contains(attribute)).orElse(false)) {
                continue;
            }
            Object value = attribute.getValue(resource);
            if (value == null && query.ignoreNullValues()) {
                continue;
            }
            if (query.ignoreDefaultValues()
                    && Objects.equals(value, RuntimeTypeConverter.getDefaultValue(attribute.getPropertyType()))) {
                continue;
            }
            object.getAttributes().put(attribute.getPublicName(), value);
        }

        for (RelationshipAttribute relationship : resourceContext.getRelationships()) {
            if (fieldSet.map(set -> !set.contains(relationship)).orElse(false)) {
                continue;
            }
            object.getRelationships()
                    .put(relationship.getPublicName(), new RelationshipObject(
                            identifiers(relationship, relationship.getValue(resource), returned)));
        }
        return object;
    }

    private void collectIncluded(
            Identifiable<?> resource,
            List<IncludeElementExpression> elements,
            QuerySpecification query,
            ReturnedResources<?> returned,
            Map<ResourceIdentity, ResourceObject> included) {
        for (IncludeElementExpression element : elements) {
            for (Identifiable<?> right : element.relationship().getRightResources(resource)) {
                if (right == null || returned.isHidden(right)) {
                    continue;
                }
                ResourceIdentity identity = ResourceIdentity.of(right);
                if (!included.containsKey(identity)) {
                    included.put(identity, build(right, query, returned));
                }
                collectIncluded(right, element.children(), query, returned, included);
            }
        }
    }

    private Object identifiers(RelationshipAttribute relationship, Object value, ReturnedResources<?> returned) {
        if (relationship.isToMany()) {
            List<ResourceIdentifierObject> identifiers = new ArrayList<>();
            if (value instanceof Collection<?> collection) {
                for (Object element : collection) {
                    if (element != null && !returned.isHidden((Identifiable<?>) element)) {
                        identifiers.add(identifier((Identifiable<?>) element));
                    }
                }
            }
            return identifiers;
        }
        if (value == null || returned.isHidden((Identifiable<?>) value)) {
            return null;
        }
        return identifier((Identifiable<?>) value);
    }

    private ResourceIdentifierObject identifier(Identifiable<?> resource) {
        ResourceContext resourceContext = resourceGraph.getResourceContext(resource.getClass());
        String id = resourceContext.getStringId(resource);
        return new ResourceIdentifierObject(resourceContext.getPublicName(), id, id == null ? resource.getLocalId() : null);
    }

    private static Document document(Object data, Map<ResourceIdentity, ResourceObject> included) {
        Document document = new Document();
        document.setData(data);
        document.setIncluded(new ArrayList<>(included.values()));
        return document;
    }
}
