package com.jsonloom.service.core.atomic;

public enum OperationKind {
    CREATE_RESOURCE,
    UPDATE_RESOURCE,
    DELETE_RESOURCE,
    SET_RELATIONSHIP,
    ADD_TO_RELATIONSHIP,
    REMOVE_FROM_RELATIONSHIP;

    public boolean isRelationshipOperation() {
        return this == SET_RELATIONSHIP || this == ADD_TO_RELATIONSHIP || this == REMOVE_FROM_RELATIONSHIP;
    }
}
