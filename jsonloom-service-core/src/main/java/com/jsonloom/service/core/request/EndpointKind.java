package com.jsonloom.service.core.request;

public enum EndpointKind {
    PRIMARY,
    SECONDARY,
    RELATIONSHIP,
    ATOMIC_OPERATIONS
}
