package com.jsonloom.service.core.queries.parsing;

/**
 * Syntax or resolution failure in a query string value. Readers translate it into an
 * {@link com.jsonloom.core.errors.InvalidQueryStringParameterException} naming the parameter.
 */
public class QueryParseException extends RuntimeException {

    public QueryParseException(String message) {
        super(message);
    }

    public QueryParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
