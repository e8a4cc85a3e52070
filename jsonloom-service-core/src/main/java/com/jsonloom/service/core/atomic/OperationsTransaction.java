package com.jsonloom.service.core.atomic;

/**
 * A unit of work spanning one atomic-operations request. Closing without committing rolls back.
 */
public interface OperationsTransaction extends AutoCloseable {

    String getTransactionId();

    /** Called before each operation; may reject operations the transaction cannot cover. */
    void beforeProcessOperation(OperationContainer operation);

    void afterProcessOperation(OperationContainer operation);

    void commit();

    @Override
    void close();
}
