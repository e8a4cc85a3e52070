package com.jsonloom.spring.transaction;

import com.jsonloom.service.core.atomic.OperationContainer;
import com.jsonloom.service.core.atomic.OperationsTransaction;
import com.jsonloom.service.core.atomic.OperationsTransactionFactory;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.DefaultTransactionDefinition;

/**
 * Runs each atomic-operations request in one transaction of the application's
 * {@link PlatformTransactionManager}. Closing without a commit rolls back.
 */
@Slf4j
public class SpringOperationsTransactionFactory implements OperationsTransactionFactory {
    private final PlatformTransactionManager transactionManager;

    public SpringOperationsTransactionFactory(PlatformTransactionManager transactionManager) {
        this.transactionManager = transactionManager;
    }

    @Override
    public OperationsTransaction beginTransaction() {
        DefaultTransactionDefinition definition =
                new DefaultTransactionDefinition(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        definition.setName("jsonloom-atomic-operations");
        return new SpringOperationsTransaction(transactionManager, transactionManager.getTransaction(definition));
    }

    static final class SpringOperationsTransaction implements OperationsTransaction {
        private final PlatformTransactionManager transactionManager;
        private final TransactionStatus status;
        private final String transactionId = UUID.randomUUID().toString();

        SpringOperationsTransaction(PlatformTransactionManager transactionManager, TransactionStatus status) {
            this.transactionManager = transactionManager;
            this.status = status;
        }

        @Override
        public String getTransactionId() {
            return transactionId;
        }

        @Override
        public void beforeProcessOperation(OperationContainer operation) {
            log.trace("Transaction {}: starting {}", transactionId, operation);
        }

        @Override
        public void afterProcessOperation(OperationContainer operation) {
            log.trace("Transaction {}: finished {}", transactionId, operation);
        }

        @Override
        public void commit() {
            transactionManager.commit(status);
        }

        @Override
        public void close() {
            if (!status.isCompleted()) {
                log.debug("Rolling back transaction {}", transactionId);
                transactionManager.rollback(status);
            }
        }
    }
}
