package com.jsonloom.controller.rest;

import com.jsonloom.api.dto.AtomicOperationsRequest;
import com.jsonloom.api.dto.AtomicOperationsResponse;
import com.jsonloom.api.dto.AtomicResultObject;
import com.jsonloom.controller.rest.serialization.AtomicOperationsReader;
import com.jsonloom.controller.rest.serialization.ResourceObjectBuilder;
import com.jsonloom.core.configuration.JsonApiOptions;
import com.jsonloom.service.core.atomic.OperationContainer;
import com.jsonloom.service.core.atomic.OperationsProcessor;
import com.jsonloom.service.core.queries.QuerySpecification;
import com.jsonloom.service.core.querystrings.DisableQueryString;
import com.jsonloom.service.core.querystrings.StandardQueryStringParameter;
import com.jsonloom.service.core.request.JsonApiRequest;
import jakarta.validation.Valid;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Executes a batch of operations in a single transaction. The response holds one result per
 * operation, or is empty (204) when no operation produced data.
 */
@Slf4j
@RestController
@DisableQueryString(StandardQueryStringParameter.ALL)
public class AtomicOperationsController implements JsonApiEndpoint {
    private final OperationsProcessor operationsProcessor;
    private final AtomicOperationsReader operationsReader;
    private final ResourceObjectBuilder objectBuilder;
    private final JsonApiOptions options;

    public AtomicOperationsController(
            OperationsProcessor operationsProcessor,
            AtomicOperationsReader operationsReader,
            ResourceObjectBuilder objectBuilder,
            JsonApiOptions options) {
        this.operationsProcessor = operationsProcessor;
        this.operationsReader = operationsReader;
        this.objectBuilder = objectBuilder;
        this.options = options;
    }

    @PostMapping("/operations")
    public ResponseEntity<AtomicOperationsResponse> postOperations(@Valid @RequestBody AtomicOperationsRequest body) {
        List<OperationContainer> operations = operationsReader.read(body);
        log.debug("Processing {} atomic operations", operations.size());

        List<OperationContainer> results = operationsProcessor.process(operations);
        if (results.stream().allMatch(Objects::isNull)) {
            return ResponseEntity.noContent().build();
        }

        QuerySpecification query = QuerySpecification.empty(options);
        List<AtomicResultObject> resultObjects = new ArrayList<>(results.size());
        for (OperationContainer result : results) {
            resultObjects.add(new AtomicResultObject(result == null ? null : objectBuilder.build(result.getResource(), query)));
        }
        return ResponseEntity.ok()
                .contentType(JsonApiMediaTypes.ATOMIC_OPERATIONS)
                .body(new AtomicOperationsResponse(resultObjects));
    }

    @Override
    public JsonApiRequest resolveRequest(Map<String, String> pathVariables) {
        return JsonApiRequest.forAtomicOperations();
    }
}
