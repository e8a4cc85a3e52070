package com.jsonloom.service.core.atomic;

import java.util.List;

/** Executes an atomic-operations batch. */
public interface OperationsProcessor {

    /**
     * Runs all operations in order within one transaction.
     *
     * @return one entry per operation, null where the operation produced no data
     * @throws com.jsonloom.core.errors.JsonApiException with pointers into {@code /atomic:operations}
     * @throws java.util.concurrent.CancellationException when the calling thread is interrupted
     */
    List<OperationContainer> process(List<OperationContainer> operations);
}
