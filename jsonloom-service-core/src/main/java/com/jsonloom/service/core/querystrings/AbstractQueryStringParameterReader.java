package com.jsonloom.service.core.querystrings;

import com.jsonloom.core.configuration.JsonApiOptions;
import com.jsonloom.core.resources.ResourceContext;
import com.jsonloom.core.resources.ResourceGraph;
import com.jsonloom.service.core.queries.expressions.ResourceFieldChainExpression;
import com.jsonloom.service.core.queries.parsing.QueryParseException;
import com.jsonloom.service.core.request.JsonApiRequest;

/** Shared state of the standard readers: the request being served, the graph and the options. */
public abstract class AbstractQueryStringParameterReader implements QueryStringParameterReader {
    protected final JsonApiRequest request;
    protected final ResourceGraph resourceGraph;
    protected final JsonApiOptions options;

    protected AbstractQueryStringParameterReader(
            JsonApiRequest request, ResourceGraph resourceGraph, JsonApiOptions options) {
        this.request = request;
        this.resourceGraph = resourceGraph;
        this.options = options;
    }

    protected ResourceContext getRequestResource() {
        ResourceContext resource = request.getRequestResource();
        if (resource == null) {
            throw new QueryParseException("This query string parameter cannot be used at this endpoint.");
        }
        return resource;
    }

    /** The resource type a scoped expression applies to: the request resource or the end of the chain. */
    protected ResourceContext getResourceContextForScope(ResourceFieldChainExpression scope) {
        if (scope == null) {
            return getRequestResource();
        }
        return scope.getTargetRelationship().getRightType();
    }

    protected void assertIsCollectionRequest() {
        if (!request.collection()) {
            throw new QueryParseException(
                    "This query string parameter can only be used on a collection of resources (not on a single resource).");
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }
}
