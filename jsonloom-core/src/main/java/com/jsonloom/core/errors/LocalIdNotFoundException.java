package com.jsonloom.core.errors;

public class LocalIdNotFoundException extends JsonApiException {

    public LocalIdNotFoundException(String localId) {
        super(new ErrorObject(
                400,
                "Server-generated value for local ID is not available at this point.",
                "Server-generated value for local ID '" + localId + "' is not available at this point."));
    }
}
