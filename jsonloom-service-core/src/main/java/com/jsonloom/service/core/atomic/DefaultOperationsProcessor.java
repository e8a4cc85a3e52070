package com.jsonloom.service.core.atomic;

import com.jsonloom.core.configuration.JsonApiOptions;
import com.jsonloom.core.errors.ErrorObject;
import com.jsonloom.core.errors.ErrorSource;
import com.jsonloom.core.errors.JsonApiException;
import com.jsonloom.core.errors.TooManyOperationsException;
import com.jsonloom.core.resources.Identifiable;
import com.jsonloom.core.resources.ResourceContext;
import com.jsonloom.core.resources.ResourceGraph;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import lombok.extern.slf4j.Slf4j;

/**
 * Validates local IDs, then runs operations one after another inside a single transaction. Local
 * IDs are swapped for server IDs as creates complete.
 */
@Slf4j
public class DefaultOperationsProcessor implements OperationsProcessor {
    private final OperationProcessorAccessor processorAccessor;
    private final OperationsTransactionFactory transactionFactory;
    private final LocalIdValidator localIdValidator;
    private final ResourceGraph resourceGraph;
    private final JsonApiOptions options;

    public DefaultOperationsProcessor(
            OperationProcessorAccessor processorAccessor,
            OperationsTransactionFactory transactionFactory,
            ResourceGraph resourceGraph,
            JsonApiOptions options) {
        this.processorAccessor = processorAccessor;
        this.transactionFactory = transactionFactory;
        this.localIdValidator = new LocalIdValidator(resourceGraph);
        this.resourceGraph = resourceGraph;
        this.options = options;
    }

    @Override
    public List<OperationContainer> process(List<OperationContainer> operations) {
        int maximum = options.getMaximumOperationsPerRequest();
        if (maximum > 0 && operations.size() > maximum) {
            throw new TooManyOperationsException(maximum);
        }

        localIdValidator.validate(operations);
        LocalIdTracker localIdTracker = new LocalIdTracker();

        List<OperationContainer> results = new ArrayList<>();
        try (OperationsTransaction transaction = transactionFactory.beginTransaction()) {
            log.debug("Processing {} operations in transaction {}", operations.size(), transaction.getTransactionId());
            for (OperationContainer operation : operations) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new CancellationException("Processing of atomic operations was cancelled.");
                }
                transaction.beforeProcessOperation(operation);
                OperationContainer result = processOperation(operation, localIdTracker);
                results.add(result);
                transaction.afterProcessOperation(operation);
            }
            transaction.commit();
            return results;
        } catch (JsonApiException e) {
            for (ErrorObject error : e.getErrors()) {
                error.prependPointer("/atomic:operations[" + results.size() + "]");
            }
            throw e;
        } catch (CancellationException e) {
            log.debug("Atomic operations cancelled after {} of {} operations", results.size(), operations.size());
            throw e;
        } catch (RuntimeException e) {
            log.error("Unhandled error while processing atomic operation at index {}", results.size(), e);
            ErrorObject error = new ErrorObject(
                    500, "An unhandled error occurred while processing an operation in this request.", e.getMessage());
            error.setSource(ErrorSource.forPointer("/atomic:operations[" + results.size() + "]"));
            throw new JsonApiException(error, e);
        }
    }

    private OperationContainer processOperation(OperationContainer operation, LocalIdTracker localIdTracker) {
        trackLocalIdsForOperation(operation, localIdTracker);

        Identifiable<?> resource = operation.getResource();
        String localId = resource.getLocalId();

        log.debug("Dispatching {} on '{}'", operation.getKind(), operation.getRequest().primaryResource());
        OperationContainer result = processorAccessor.process(operation);

        if (operation.getKind() == OperationKind.CREATE_RESOURCE && localId != null) {
            ResourceContext type = typeOf(resource);
            Identifiable<?> created = result != null ? result.getResource() : resource;
            localIdTracker.assign(localId, type.getPublicName(), type.getStringId(created));
        }
        return result;
    }

    private void trackLocalIdsForOperation(OperationContainer operation, LocalIdTracker localIdTracker) {
        if (operation.getKind() == OperationKind.CREATE_RESOURCE) {
            declareLocalId(operation.getResource(), localIdTracker);
        } else {
            assignStringId(operation.getResource(), localIdTracker);
        }
        for (Identifiable<?> secondary : operation.getSecondaryResources()) {
            assignStringId(secondary, localIdTracker);
        }
    }

    private void declareLocalId(Identifiable<?> resource, LocalIdTracker localIdTracker) {
        if (resource.getLocalId() != null) {
            localIdTracker.declare(resource.getLocalId(), typeOf(resource).getPublicName());
        }
    }

    private void assignStringId(Identifiable<?> resource, LocalIdTracker localIdTracker) {
        if (resource.getLocalId() != null) {
            ResourceContext type = typeOf(resource);
            type.setStringId(resource, localIdTracker.getValue(resource.getLocalId(), type.getPublicName()));
        }
    }

    private ResourceContext typeOf(Identifiable<?> resource) {
        return resourceGraph.getResourceContext(resource.getClass());
    }
}
