package com.jsonloom.core.errors;

/** The route names a resource type that is not part of the resource graph. */
public class ResourceTypeNotFoundException extends JsonApiException {

    public ResourceTypeNotFoundException(String resourceType) {
        super(new ErrorObject(
                404,
                "The requested resource type does not exist.",
                "Resource type '" + resourceType + "' does not exist."));
    }
}
