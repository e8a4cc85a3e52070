package com.jsonloom.core.errors;

public class LocalIdAlreadyDeclaredException extends JsonApiException {

    public LocalIdAlreadyDeclaredException(String localId) {
        super(new ErrorObject(
                400,
                "Another local ID with the same name is already defined at this point.",
                "Another local ID with name '" + localId + "' is already defined at this point."));
    }
}
