package com.jsonloom.core.errors;

public class MissingTransactionSupportException extends JsonApiException {

    public MissingTransactionSupportException(String resourceType) {
        super(new ErrorObject(
                422,
                "Unsupported resource type in atomic:operations request.",
                "Operations on resources of type '" + resourceType
                        + "' cannot be used because transaction support is unavailable."));
    }
}
