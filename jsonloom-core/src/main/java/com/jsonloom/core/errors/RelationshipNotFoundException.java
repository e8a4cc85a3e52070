package com.jsonloom.core.errors;

public class RelationshipNotFoundException extends JsonApiException {

    public RelationshipNotFoundException(String relationshipName, String resourceType) {
        super(new ErrorObject(
                404,
                "The requested relationship does not exist.",
                "Resource of type '" + resourceType + "' does not contain a relationship named '" + relationshipName
                        + "'."));
    }
}
