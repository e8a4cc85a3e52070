package com.jsonloom.service.core.hooks;

/** The service operation a hook is invoked from. */
public enum ResourcePipeline {
    GET,
    GET_SINGLE,
    GET_RELATIONSHIP,
    POST,
    PATCH,
    PATCH_RELATIONSHIP,
    DELETE
}
