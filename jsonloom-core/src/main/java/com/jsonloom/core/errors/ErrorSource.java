package com.jsonloom.core.errors;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Points at the part of the request that caused an error. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorSource(String pointer, String parameter) {

    public static ErrorSource forPointer(String pointer) {
        return new ErrorSource(pointer, null);
    }

    public static ErrorSource forParameter(String parameter) {
        return new ErrorSource(null, parameter);
    }
}
