package com.jsonloom.core.errors;

/** No processor is registered for the requested operation on this resource type. */
public class UnsupportedOperationTypeException extends JsonApiException {

    public UnsupportedOperationTypeException(String operation, String resourceType) {
        super(new ErrorObject(
                403,
                "The requested operation is not accessible.",
                "The '" + operation + "' operation is not accessible for resource type '" + resourceType + "'."));
    }
}
