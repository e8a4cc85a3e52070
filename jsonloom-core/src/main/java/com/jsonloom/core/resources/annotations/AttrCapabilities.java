package com.jsonloom.core.resources.annotations;

/** What clients may do with an attribute. */
public enum AttrCapabilities {
    ALLOW_VIEW,
    ALLOW_FILTER,
    ALLOW_SORT,
    ALLOW_CREATE,
    ALLOW_CHANGE
}
