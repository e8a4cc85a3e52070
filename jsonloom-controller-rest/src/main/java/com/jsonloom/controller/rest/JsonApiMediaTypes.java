package com.jsonloom.controller.rest;

import org.springframework.http.MediaType;

public final class JsonApiMediaTypes {

    public static final String JSON_API_VALUE = "application/vnd.api+json";
    public static final MediaType JSON_API = MediaType.parseMediaType(JSON_API_VALUE);

    public static final String ATOMIC_OPERATIONS_VALUE = JSON_API_VALUE + "; ext=\"https://jsonapi.org/ext/atomic\"";
    public static final MediaType ATOMIC_OPERATIONS = MediaType.parseMediaType(ATOMIC_OPERATIONS_VALUE);

    private JsonApiMediaTypes() {}
}
