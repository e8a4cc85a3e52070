package com.jsonloom.core.errors;

/** The request body is not a valid document for the targeted endpoint. */
public class InvalidRequestBodyException extends JsonApiException {

    public InvalidRequestBodyException(String title, String detail, String pointer) {
        this(title, detail, pointer, null);
    }

    public InvalidRequestBodyException(String title, String detail, String pointer, Throwable cause) {
        super(build(title, detail, pointer), cause);
    }

    private static ErrorObject build(String title, String detail, String pointer) {
        String fullTitle =
                title != null ? "Failed to deserialize request body: " + title : "Failed to deserialize request body.";
        ErrorObject error = new ErrorObject(422, fullTitle, detail);
        if (pointer != null) {
            error.setSource(ErrorSource.forPointer(pointer));
        }
        return error;
    }
}
