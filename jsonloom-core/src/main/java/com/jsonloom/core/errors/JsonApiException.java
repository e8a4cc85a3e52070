package com.jsonloom.core.errors;

import java.util.List;
import java.util.stream.Collectors;

/** Base exception carrying one or more JSON:API error objects to be returned to the client. */
public class JsonApiException extends RuntimeException {
    private final List<ErrorObject> errors;

    public JsonApiException(ErrorObject error) {
        this(List.of(error), null);
    }

    public JsonApiException(ErrorObject error, Throwable cause) {
        this(List.of(error), cause);
    }

    public JsonApiException(List<ErrorObject> errors, Throwable cause) {
        super(describe(errors), cause);
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("At least one error is required");
        }
        this.errors = List.copyOf(errors);
    }

    public List<ErrorObject> getErrors() {
        return errors;
    }

    private static String describe(List<ErrorObject> errors) {
        return errors.stream().map(ErrorObject::toString).collect(Collectors.joining("; "));
    }
}
