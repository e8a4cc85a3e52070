package com.jsonloom.controller.rest;

import com.jsonloom.api.dto.Document;
import com.jsonloom.core.errors.RelationshipNotFoundException;
import com.jsonloom.core.errors.ResourceNotFoundException;
import com.jsonloom.core.errors.ResourceTypeNotFoundException;
import com.jsonloom.core.resources.Identifiable;
import com.jsonloom.core.resources.RelationshipAttribute;
import com.jsonloom.core.resources.ResourceContext;
import com.jsonloom.core.resources.ResourceGraph;
import com.jsonloom.controller.rest.serialization.ResourceObjectBuilder;
import com.jsonloom.service.core.queries.QuerySpecification;
import com.jsonloom.service.core.hooks.ReturnedResources;
import com.jsonloom.service.core.querystrings.DisableQueryString;
import com.jsonloom.service.core.querystrings.StandardQueryStringParameter;
import com.jsonloom.service.core.request.JsonApiRequest;
import com.jsonloom.service.core.services.ResourceService;
import com.jsonloom.service.core.services.ResourceServiceRegistry;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/** Read and delete endpoints for every resource type in the graph. */
@Slf4j
@RestController
public class ResourceController implements JsonApiEndpoint {
    private final ResourceGraph resourceGraph;
    private final ResourceServiceRegistry serviceRegistry;
    private final ResourceObjectBuilder objectBuilder;

    public ResourceController(
            ResourceGraph resourceGraph, ResourceServiceRegistry serviceRegistry, ResourceObjectBuilder objectBuilder) {
        this.resourceGraph = resourceGraph;
        this.serviceRegistry = serviceRegistry;
        this.objectBuilder = objectBuilder;
    }

    @GetMapping(value = "/{type}", produces = JsonApiMediaTypes.JSON_API_VALUE)
    public Document getAll(
            @PathVariable String type,
            @RequestAttribute(QueryStringInterceptor.QUERY_SPECIFICATION_ATTRIBUTE) QuerySpecification query) {
        ResourceContext resourceContext = resolveType(type);
        ReturnedResources<?> returned = serviceFor(resourceContext).getAll(query);
        return objectBuilder.buildCollection(returned, query);
    }

    @GetMapping(value = "/{type}/{id}", produces = JsonApiMediaTypes.JSON_API_VALUE)
    public Document getById(
            @PathVariable String type,
            @PathVariable String id,
            @RequestAttribute(QueryStringInterceptor.QUERY_SPECIFICATION_ATTRIBUTE) QuerySpecification query) {
        ResourceContext resourceContext = resolveType(type);
        ReturnedResources<?> returned = getById(serviceFor(resourceContext), parseId(resourceContext, id), query);
        return objectBuilder.buildSingle(returned, query);
    }

    @DisableQueryString(StandardQueryStringParameter.ALL)
    @GetMapping(value = "/{type}/{id}/relationships/{relationship}", produces = JsonApiMediaTypes.JSON_API_VALUE)
    public Document getRelationship(
            @PathVariable String type, @PathVariable String id, @PathVariable String relationship) {
        ResourceContext resourceContext = resolveType(type);
        RelationshipAttribute attribute = resolveRelationship(resourceContext, relationship);
        Object value = getRelationship(serviceFor(resourceContext), parseId(resourceContext, id), relationship);
        return objectBuilder.buildRelationship(attribute, value);
    }

    @DeleteMapping("/{type}/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable String type, @PathVariable String id) {
        ResourceContext resourceContext = resolveType(type);
        delete(serviceFor(resourceContext), parseId(resourceContext, id));
        log.debug("Deleted '{}' with ID '{}'", type, id);
    }

    @Override
    public JsonApiRequest resolveRequest(Map<String, String> pathVariables) {
        ResourceContext resourceContext = resolveType(pathVariables.get("type"));
        String id = pathVariables.get("id");
        if (id == null) {
            return JsonApiRequest.forCollection(resourceContext);
        }
        String relationship = pathVariables.get("relationship");
        if (relationship != null) {
            return JsonApiRequest.forRelationship(resourceContext, id, resolveRelationship(resourceContext, relationship));
        }
        return JsonApiRequest.forSingle(resourceContext, id);
    }

    private ResourceContext resolveType(String type) {
        return resourceGraph.findResourceContext(type).orElseThrow(() -> new ResourceTypeNotFoundException(type));
    }

    private static RelationshipAttribute resolveRelationship(ResourceContext resourceContext, String relationship) {
        return resourceContext
                .findRelationship(relationship)
                .orElseThrow(() -> new RelationshipNotFoundException(relationship, resourceContext.getPublicName()));
    }

    private ResourceService<?, ?> serviceFor(ResourceContext resourceContext) {
        return serviceRegistry
                .find(resourceContext.getResourceClass())
                .orElseThrow(() -> new IllegalStateException(
                        "No resource service registered for '" + resourceContext.getPublicName() + "'."));
    }

    private static Object parseId(ResourceContext resourceContext, String id) {
        try {
            return resourceContext.parseId(id);
        } catch (IllegalArgumentException e) {
            throw new ResourceNotFoundException(id, resourceContext.getPublicName());
        }
    }

    @SuppressWarnings("unchecked")
    private static <T extends Identifiable<ID>, ID> ReturnedResources<T> getById(
            ResourceService<T, ID> service, Object id, QuerySpecification query) {
        return service.getById((ID) id, query);
    }

    @SuppressWarnings("unchecked")
    private static <T extends Identifiable<ID>, ID> Object getRelationship(
            ResourceService<T, ID> service, Object id, String relationship) {
        return service.getRelationship((ID) id, relationship);
    }

    @SuppressWarnings("unchecked")
    private static <T extends Identifiable<ID>, ID> void delete(ResourceService<T, ID> service, Object id) {
        service.delete((ID) id);
    }
}
