package com.jsonloom.service.core.atomic;

/** Executes a single operation of one kind against one resource type. */
public interface OperationProcessor {

    /** @return the operation result, or null when it produced no data */
    OperationContainer process(OperationContainer operation);
}
