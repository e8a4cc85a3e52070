package com.jsonloom.core.errors;

/** A query string parameter that could not be accepted. The error source names the parameter. */
public class InvalidQueryStringParameterException extends JsonApiException {
    private final String parameterName;

    public InvalidQueryStringParameterException(String parameterName, String title, String detail) {
        this(parameterName, title, detail, null);
    }

    public InvalidQueryStringParameterException(String parameterName, String title, String detail, Throwable cause) {
        super(build(parameterName, title, detail), cause);
        this.parameterName = parameterName;
    }

    public String getParameterName() {
        return parameterName;
    }

    private static ErrorObject build(String parameterName, String title, String detail) {
        ErrorObject error = new ErrorObject(400, title, detail);
        error.setSource(ErrorSource.forParameter(parameterName));
        return error;
    }
}
