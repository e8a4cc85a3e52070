package com.jsonloom.service.core.atomic;

import com.jsonloom.core.errors.MissingTransactionSupportException;
import java.util.UUID;

/**
 * Stand-in when no transaction infrastructure is configured: the first operation of every batch
 * is rejected.
 */
public class MissingTransactionFactory implements OperationsTransactionFactory {

    @Override
    public OperationsTransaction beginTransaction() {
        return new OperationsTransaction() {
            private final String transactionId = UUID.randomUUID().toString();

            @Override
            public String getTransactionId() {
                return transactionId;
            }

            @Override
            public void beforeProcessOperation(OperationContainer operation) {
                throw new MissingTransactionSupportException(
                        operation.getRequest().primaryResource().getPublicName());
            }

            @Override
            public void afterProcessOperation(OperationContainer operation) {}

            @Override
            public void commit() {}

            @Override
            public void close() {}
        };
    }
}
