package com.jsonloom.controller.rest.serialization;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jsonloom.api.dto.AtomicOperationObject;
import com.jsonloom.api.dto.AtomicOperationsRequest;
import com.jsonloom.api.dto.AtomicReference;
import com.jsonloom.core.errors.InvalidRequestBodyException;
import com.jsonloom.core.errors.JsonApiException;
import com.jsonloom.core.resources.AttrAttribute;
import com.jsonloom.core.resources.Identifiable;
import com.jsonloom.core.resources.RelationshipAttribute;
import com.jsonloom.core.resources.ResourceContext;
import com.jsonloom.core.resources.ResourceGraph;
import com.jsonloom.core.resources.annotations.AttrCapabilities;
import com.jsonloom.service.core.atomic.OperationContainer;
import com.jsonloom.service.core.atomic.OperationKind;
import com.jsonloom.service.core.request.JsonApiRequest;
import com.jsonloom.service.core.request.TargetedFields;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts an atomic-operations request body into {@link OperationContainer}s. Errors point into the
 * body, prefixed with the index of the failing operation.
 */
public class AtomicOperationsReader {
    private final ResourceGraph resourceGraph;
    private final ObjectMapper objectMapper;

    public AtomicOperationsReader(ResourceGraph resourceGraph, ObjectMapper objectMapper) {
        this.resourceGraph = resourceGraph;
        this.objectMapper = objectMapper;
    }

    public List<OperationContainer> read(AtomicOperationsRequest request) {
        if (request.getOperations() == null || request.getOperations().isEmpty()) {
            throw new InvalidRequestBodyException(
                    "No operations found.", "The list of operations must contain at least one entry.", "/atomic:operations");
        }

        List<OperationContainer> operations = new ArrayList<>();
        for (int index = 0; index < request.getOperations().size(); index++) {
            try {
                operations.add(readOperation(request.getOperations().get(index)));
            } catch (JsonApiException e) {
                String prefix = "/atomic:operations[" + index + "]";
                e.getErrors().forEach(error -> error.prependPointer(prefix));
                throw e;
            }
        }
        return operations;
    }

    private OperationContainer readOperation(AtomicOperationObject operation) {
        if (operation.getHref() != null) {
            throw new InvalidRequestBodyException(
                    "Usage of the 'href' element is not supported.", null, "/href");
        }
        String code = operation.getOp();
        AtomicReference ref = operation.getRef();
        boolean targetsRelationship = ref != null && ref.getRelationship() != null;

        if ("add".equals(code)) {
            return targetsRelationship
                    ? readRelationshipOperation(OperationKind.ADD_TO_RELATIONSHIP, operation)
                    : readResourceOperation(OperationKind.CREATE_RESOURCE, operation);
        }
        if ("update".equals(code)) {
            return targetsRelationship
                    ? readRelationshipOperation(OperationKind.SET_RELATIONSHIP, operation)
                    : readResourceOperation(OperationKind.UPDATE_RESOURCE, operation);
        }
        if ("remove".equals(code)) {
            return targetsRelationship
                    ? readRelationshipOperation(OperationKind.REMOVE_FROM_RELATIONSHIP, operation)
                    : readDelete(operation);
        }
        throw new InvalidRequestBodyException(
                "Unknown operation code.", "The operation code '" + code + "' is not one of 'add', 'update' or 'remove'.", "/op");
    }

    private OperationContainer readDelete(AtomicOperationObject operation) {
        AtomicReference ref = operation.getRef();
        if (ref == null) {
            throw new InvalidRequestBodyException(
                    "The 'ref' element is required.", "A 'remove' operation must identify the resource to delete.", "/ref");
        }
        ResourceContext resourceContext = resolveType(ref.getType(), "/ref/type");
        Identifiable<?> resource = createIdentity(resourceContext, ref.getId(), ref.getLid(), "/ref");
        return new OperationContainer(
                OperationKind.DELETE_RESOURCE,
                resource,
                TargetedFields.NONE,
                JsonApiRequest.forSingle(resourceContext, ref.getId()));
    }

    private OperationContainer readResourceOperation(OperationKind kind, AtomicOperationObject operation) {
        JsonNode data = operation.getData();
        if (data == null || !data.isObject()) {
            throw new InvalidRequestBodyException(
                    "Expected an object in 'data' element.", "A resource object is required for this operation.", "/data");
        }
        ResourceContext resourceContext = resolveType(textOf(data, "type"), "/data/type");
        AtomicReference ref = operation.getRef();
        if (ref != null && !resourceContext.getPublicName().equals(ref.getType())) {
            throw new InvalidRequestBodyException(
                    "Resource type mismatch between 'ref.type' and 'data.type' element.",
                    "Expected resource of type '" + ref.getType() + "' in 'data.type', instead of '"
                            + resourceContext.getPublicName() + "'.",
                    "/data/type");
        }

        String id = textOf(data, "id");
        String lid = textOf(data, "lid");
        Identifiable<?> resource;
        if (kind == OperationKind.CREATE_RESOURCE) {
            resource = resourceContext.createInstance();
            if (id != null) {
                assignId(resourceContext, resource, id, "/data/id");
            }
            resource.setLocalId(lid);
        } else {
            if (ref != null) {
                assertSameIdentity(ref, id, lid);
            }
            if (id == null && lid == null && ref != null) {
                id = ref.getId();
                lid = ref.getLid();
            }
            resource = createIdentity(resourceContext, id, lid, "/data");
        }

        Set<AttrAttribute> attributes = readAttributes(kind, resourceContext, resource, data.get("attributes"));
        Set<RelationshipAttribute> relationships = readRelationships(resourceContext, resource, data.get("relationships"));
        TargetedFields targetedFields = new TargetedFields(attributes, relationships);

        JsonApiRequest request = kind == OperationKind.CREATE_RESOURCE
                ? JsonApiRequest.forCollection(resourceContext)
                : JsonApiRequest.forSingle(resourceContext, id);
        return new OperationContainer(kind, resource, targetedFields, request);
    }

    private static void assertSameIdentity(AtomicReference ref, String id, String lid) {
        if (id == null && lid == null) {
            return;
        }
        if (ref.getId() != null && id != null && !ref.getId().equals(id)) {
            throw new InvalidRequestBodyException(
                    "Resource ID mismatch between 'ref.id' and 'data.id' element.",
                    "Expected resource with ID '" + ref.getId() + "' in 'data.id', instead of '" + id + "'.",
                    "/data/id");
        }
        if (ref.getLid() != null && lid != null && !ref.getLid().equals(lid)) {
            throw new InvalidRequestBodyException(
                    "Resource local ID mismatch between 'ref.lid' and 'data.lid' element.",
                    "Expected resource with local ID '" + ref.getLid() + "' in 'data.lid', instead of '" + lid + "'.",
                    "/data/lid");
        }
        if (ref.getId() != null && id == null) {
            throw new InvalidRequestBodyException(
                    "Resource identity mismatch between 'ref.id' and 'data.lid' element.",
                    "Expected resource with ID '" + ref.getId() + "' in 'data.id', instead of 'data.lid'.",
                    "/data/lid");
        }
        if (ref.getLid() != null && lid == null) {
            throw new InvalidRequestBodyException(
                    "Resource identity mismatch between 'ref.lid' and 'data.id' element.",
                    "Expected resource with local ID '" + ref.getLid() + "' in 'data.lid', instead of 'data.id'.",
                    "/data/id");
        }
    }

    private OperationContainer readRelationshipOperation(OperationKind kind, AtomicOperationObject operation) {
        AtomicReference ref = operation.getRef();
        ResourceContext resourceContext = resolveType(ref.getType(), "/ref/type");
        RelationshipAttribute relationship = resourceContext
                .findRelationship(ref.getRelationship())
                .orElseThrow(() -> new InvalidRequestBodyException(
                        "The referenced relationship does not exist.",
                        "Resource of type '" + resourceContext.getPublicName() + "' does not contain a relationship named '"
                                + ref.getRelationship() + "'.",
                        "/ref/relationship"));
        if (kind != OperationKind.SET_RELATIONSHIP && !relationship.isToMany()) {
            throw new InvalidRequestBodyException(
                    "Only to-many relationships can be targeted through this operation.",
                    "Relationship '" + relationship.getPublicName() + "' is not a to-many relationship.",
                    "/ref/relationship");
        }
        if (operation.getData() == null) {
            throw new InvalidRequestBodyException(
                    "The 'data' element is required.", "Relationship operations must contain a 'data' element.", "/data");
        }

        Identifiable<?> resource = createIdentity(resourceContext, ref.getId(), ref.getLid(), "/ref");
        relationship.setRightResources(resource, readRelationshipData(relationship, operation.getData(), "/data"));
        return new OperationContainer(
                kind,
                resource,
                new TargetedFields(Set.of(), Set.of(relationship)),
                JsonApiRequest.forRelationship(resourceContext, ref.getId(), relationship));
    }

    private Set<AttrAttribute> readAttributes(
            OperationKind kind, ResourceContext resourceContext, Identifiable<?> resource, JsonNode attributes) {
        Set<AttrAttribute> targeted = new LinkedHashSet<>();
        if (attributes == null || attributes.isNull()) {
            return targeted;
        }
        AttrCapabilities required =
                kind == OperationKind.CREATE_RESOURCE ? AttrCapabilities.ALLOW_CREATE : AttrCapabilities.ALLOW_CHANGE;
        Iterator<Map.Entry<String, JsonNode>> fields = attributes.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String pointer = "/data/attributes/" + field.getKey();
            AttrAttribute attribute = resourceContext
                    .findAttribute(field.getKey())
                    .orElseThrow(() -> new InvalidRequestBodyException(
                            "Unknown attribute found.",
                            "Attribute '" + field.getKey() + "' does not exist on resource type '"
                                    + resourceContext.getPublicName() + "'.",
                            pointer));
            if (!attribute.hasCapability(required)) {
                throw new InvalidRequestBodyException(
                        required == AttrCapabilities.ALLOW_CREATE
                                ? "Setting the initial value of the requested attribute is not allowed."
                                : "Changing the value of the requested attribute is not allowed.",
                        "Setting the value of '" + attribute.getPublicName() + "' is not allowed.",
                        pointer);
            }
            attribute.setValue(resource, convertAttribute(attribute, field.getValue(), pointer));
            targeted.add(attribute);
        }
        return targeted;
    }

    private Object convertAttribute(AttrAttribute attribute, JsonNode value, String pointer) {
        JavaType type = objectMapper.getTypeFactory().constructType(attribute.getProperty().getGenericType());
        if (value.isNull() && type.isPrimitive()) {
            throw new InvalidRequestBodyException(
                    "Incompatible attribute value found.",
                    "Failed to convert attribute '" + attribute.getPublicName() + "' with value 'null' to type '"
                            + type.getRawClass().getSimpleName() + "'.",
                    pointer);
        }
        try {
            return objectMapper.convertValue(value, type);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestBodyException(
                    "Incompatible attribute value found.",
                    "Failed to convert attribute '" + attribute.getPublicName() + "' with value '" + value + "' to type '"
                            + type.getRawClass().getSimpleName() + "'.",
                    pointer,
                    e);
        }
    }

    private Set<RelationshipAttribute> readRelationships(
            ResourceContext resourceContext, Identifiable<?> resource, JsonNode relationships) {
        Set<RelationshipAttribute> targeted = new LinkedHashSet<>();
        if (relationships == null || relationships.isNull()) {
            return targeted;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = relationships.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String pointer = "/data/relationships/" + field.getKey();
            RelationshipAttribute relationship = resourceContext
                    .findRelationship(field.getKey())
                    .orElseThrow(() -> new InvalidRequestBodyException(
                            "Unknown relationship found.",
                            "Relationship '" + field.getKey() + "' does not exist on resource type '"
                                    + resourceContext.getPublicName() + "'.",
                            pointer));
            JsonNode data = field.getValue().get("data");
            if (data == null) {
                throw new InvalidRequestBodyException(
                        "Expected 'data' element in relationship object.", null, pointer);
            }
            relationship.setRightResources(resource, readRelationshipData(relationship, data, pointer + "/data"));
            targeted.add(relationship);
        }
        return targeted;
    }

    private List<Identifiable<?>> readRelationshipData(RelationshipAttribute relationship, JsonNode data, String pointer) {
        List<Identifiable<?>> rightResources = new ArrayList<>();
        if (relationship.isToMany()) {
            if (!data.isArray()) {
                throw new InvalidRequestBodyException(
                        "Expected an array in 'data' element.",
                        "Relationship '" + relationship.getPublicName() + "' is a to-many relationship.",
                        pointer);
            }
            for (int index = 0; index < data.size(); index++) {
                rightResources.add(readIdentifier(relationship, data.get(index), pointer + "[" + index + "]"));
            }
        } else if (!data.isNull()) {
            if (!data.isObject()) {
                throw new InvalidRequestBodyException(
                        "Expected an object or 'null' in 'data' element.",
                        "Relationship '" + relationship.getPublicName() + "' is a to-one relationship.",
                        pointer);
            }
            rightResources.add(readIdentifier(relationship, data, pointer));
        }
        return rightResources;
    }

    private Identifiable<?> readIdentifier(RelationshipAttribute relationship, JsonNode identifier, String pointer) {
        ResourceContext rightType = resolveType(textOf(identifier, "type"), pointer + "/type");
        if (!relationship.getRightType().getResourceClass().isAssignableFrom(rightType.getResourceClass())) {
            throw new InvalidRequestBodyException(
                    "Incompatible resource type found.",
                    "Type '" + rightType.getPublicName() + "' is incompatible with type '"
                            + relationship.getRightType().getPublicName() + "' of relationship '"
                            + relationship.getPublicName() + "'.",
                    pointer + "/type");
        }
        return createIdentity(rightType, textOf(identifier, "id"), textOf(identifier, "lid"), pointer);
    }

    private Identifiable<?> createIdentity(ResourceContext resourceContext, String id, String lid, String pointer) {
        if (id == null && lid == null) {
            throw new InvalidRequestBodyException(
                    "The 'id' or 'lid' element is required.", null, pointer);
        }
        if (id != null && lid != null) {
            throw new InvalidRequestBodyException(
                    "The 'id' and 'lid' element are mutually exclusive.", null, pointer);
        }
        Identifiable<?> resource = resourceContext.createInstance();
        if (id != null) {
            assignId(resourceContext, resource, id, pointer + "/id");
        } else {
            resource.setLocalId(lid);
        }
        return resource;
    }

    private static void assignId(ResourceContext resourceContext, Identifiable<?> resource, String id, String pointer) {
        try {
            resourceContext.setStringId(resource, id);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestBodyException(
                    "Incompatible 'id' value found.", e.getMessage(), pointer, e);
        }
    }

    private ResourceContext resolveType(String type, String pointer) {
        if (type == null) {
            throw new InvalidRequestBodyException("The 'type' element is required.", null, pointer);
        }
        return resourceGraph
                .findResourceContext(type)
                .orElseThrow(() -> new InvalidRequestBodyException(
                        "Unknown resource type found.", "Resource type '" + type + "' does not exist.", pointer));
    }

    private static String textOf(JsonNode node, String fieldName) {
        JsonNode value = node.get(fieldName);
        return value == null || value.isNull() ? null : value.asText();
    }
}
