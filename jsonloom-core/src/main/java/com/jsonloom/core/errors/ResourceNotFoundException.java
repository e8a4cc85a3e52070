package com.jsonloom.core.errors;

public class ResourceNotFoundException extends JsonApiException {

    public ResourceNotFoundException(String resourceId, String resourceType) {
        super(new ErrorObject(
                404,
                "The requested resource does not exist.",
                "Resource of type '" + resourceType + "' with ID '" + resourceId + "' does not exist."));
    }
}
