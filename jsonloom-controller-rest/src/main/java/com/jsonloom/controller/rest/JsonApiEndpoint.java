package com.jsonloom.controller.rest;

import com.jsonloom.service.core.request.JsonApiRequest;
import java.util.Map;

/** A controller whose query string is read by {@link QueryStringInterceptor}. */
public interface JsonApiEndpoint {

    /**
     * Describes the request from its matched path variables.
     *
     * @throws com.jsonloom.core.errors.JsonApiException when the route names an unknown type or relationship
     */
    JsonApiRequest resolveRequest(Map<String, String> pathVariables);
}
