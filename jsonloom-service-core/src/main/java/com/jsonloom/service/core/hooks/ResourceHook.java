package com.jsonloom.service.core.hooks;

public enum ResourceHook {
    BEFORE_READ,
    AFTER_READ,
    ON_RETURN,
    BEFORE_CREATE,
    AFTER_CREATE,
    BEFORE_UPDATE,
    AFTER_UPDATE,
    BEFORE_DELETE,
    AFTER_DELETE
}
