package com.jsonloom.service.core.querystrings;

import java.util.Set;

/** The query string parameters defined by JSON:API and the serializer overrides. */
public enum StandardQueryStringParameter {
    INCLUDE,
    FILTER,
    SORT,
    PAGE,
    FIELDS,
    NULLS,
    DEFAULTS,
    ALL;

    public static boolean isDisabled(Set<StandardQueryStringParameter> disabled, StandardQueryStringParameter parameter) {
        return disabled.contains(ALL) || disabled.contains(parameter);
    }
}
