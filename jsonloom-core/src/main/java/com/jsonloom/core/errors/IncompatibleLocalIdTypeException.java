package com.jsonloom.core.errors;

public class IncompatibleLocalIdTypeException extends JsonApiException {

    public IncompatibleLocalIdTypeException(String localId, String declaredType, String currentType) {
        super(new ErrorObject(
                400,
                "Incompatible type in Local ID usage.",
                "Local ID '" + localId + "' belongs to resource type '" + declaredType + "' instead of '"
                        + currentType + "'."));
    }
}
