package com.jsonloom.core.errors;

/** A local ID is referenced by the same operation that declares it. */
public class LocalIdNotAssignedException extends JsonApiException {

    public LocalIdNotAssignedException(String localId) {
        super(new ErrorObject(
                400,
                "Local ID cannot be both defined and used within the same operation.",
                "Local ID '" + localId + "' cannot be both defined and used within the same operation."));
    }
}
