package com.jsonloom.controller.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jsonloom.controller.rest.serialization.AtomicOperationsReader;
import com.jsonloom.controller.rest.serialization.ResourceObjectBuilder;
import com.jsonloom.core.configuration.JsonApiOptions;
import com.jsonloom.core.resources.ResourceGraph;
import com.jsonloom.service.core.atomic.DefaultOperationsProcessor;
import com.jsonloom.service.core.atomic.OperationProcessorAccessor;
import com.jsonloom.service.core.fixtures.Fixtures;
import com.jsonloom.service.core.fixtures.InMemoryDataStore;
import com.jsonloom.service.core.fixtures.InMemoryServices;
import com.jsonloom.service.core.fixtures.InMemoryTransactionFactory;
import com.jsonloom.service.core.fixtures.UserAccount;
import com.jsonloom.service.core.fixtures.WorkItem;
import com.jsonloom.service.core.hooks.NoResourceHookExecutor;
import com.jsonloom.service.core.querystrings.QueryStringReaderFactory;
import com.jsonloom.service.core.services.ResourceServiceRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class AtomicOperationsControllerTest {

    private final ResourceGraph graph = Fixtures.graph();
    private final JsonApiOptions options = Fixtures.options();
    private InMemoryDataStore store;
    private InMemoryTransactionFactory transactions;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        store = new InMemoryDataStore();
        store.save(new UserAccount(7L, "Jane", "Doe"));
        store.save(new WorkItem(1, "Fix login"));
        transactions = new InMemoryTransactionFactory();

        ResourceServiceRegistry registry = InMemoryServices.registry(graph, store, NoResourceHookExecutor.INSTANCE);
        DefaultOperationsProcessor processor =
                new DefaultOperationsProcessor(new OperationProcessorAccessor(registry), transactions, graph, options);
        ResourceObjectBuilder objectBuilder = new ResourceObjectBuilder(graph);
        mockMvc = MockMvcBuilders.standaloneSetup(new AtomicOperationsController(
                        processor, new AtomicOperationsReader(graph, new ObjectMapper()), objectBuilder, options))
                .setControllerAdvice(new JsonApiExceptionHandler(options))
                .addInterceptors(new QueryStringInterceptor(new QueryStringReaderFactory(graph, options)))
                .build();
    }

    private ResultActions postOperations(String json) throws Exception {
        return mockMvc.perform(post("/operations").contentType(MediaType.APPLICATION_JSON).content(json));
    }

    @Test
    void createThenRelateThroughLocalId() throws Exception {
        String body = """
                {"atomic:operations": [
                  {"op": "add", "data": {"type": "workItems", "lid": "new-item",
                    "attributes": {"description": "Plan release", "priority": "HIGH"}}},
                  {"op": "update", "ref": {"type": "workItems", "lid": "new-item", "relationship": "assignee"},
                    "data": {"type": "userAccounts", "id": "7"}}
                ]}""";

        postOperations(body)
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(JsonApiMediaTypes.JSON_API))
                .andExpect(jsonPath("$['atomic:results']", hasSize(2)))
                .andExpect(jsonPath("$['atomic:results'][0].data.type").value("workItems"))
                .andExpect(jsonPath("$['atomic:results'][0].data.id").value("1001"))
                .andExpect(jsonPath("$['atomic:results'][0].data.attributes.description").value("Plan release"))
                .andExpect(jsonPath("$['atomic:results'][1].data").doesNotExist());

        WorkItem created = store.find(WorkItem.class, 1001).orElseThrow();
        assertThat(created.getAssignee().getFirstName()).isEqualTo("Jane");
        assertThat(transactions.getCommitted()).isEqualTo(1);
    }

    @Test
    void operationsWithoutDataReturnNoContent() throws Exception {
        postOperations("""
                {"atomic:operations": [
                  {"op": "add", "ref": {"type": "workItems", "id": "1", "relationship": "subscribers"},
                    "data": [{"type": "userAccounts", "id": "7"}]},
                  {"op": "remove", "ref": {"type": "userAccounts", "id": "7"}}
                ]}""").andExpect(status().isNoContent());

        assertThat(store.find(UserAccount.class, 7L)).isEmpty();
    }

    @Test
    void unknownLocalIdFailsBeforeAnyOperationRuns() throws Exception {
        postOperations("""
                {"atomic:operations": [
                  {"op": "update", "ref": {"type": "workItems", "lid": "unknown", "relationship": "assignee"},
                    "data": null}
                ]}""")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0].source.pointer").value("/atomic:operations[0]/ref/lid"));

        assertThat(transactions.getStarted()).isZero();
    }

    @Test
    void failingOperationRollsBackWithPointer() throws Exception {
        postOperations("""
                {"atomic:operations": [
                  {"op": "add", "data": {"type": "workItems", "attributes": {"description": "Kept?"}}},
                  {"op": "remove", "ref": {"type": "workItems", "id": "99"}}
                ]}""")
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errors[0].source.pointer").value("/atomic:operations[1]"));

        assertThat(transactions.getRolledBack()).isEqualTo(1);
    }

    @Test
    void unknownResourceTypeInBodyPointsAtType() throws Exception {
        postOperations("""
                {"atomic:operations": [
                  {"op": "remove", "ref": {"type": "workItems", "id": "1"}},
                  {"op": "add", "data": {"type": "unknownThings"}}
                ]}""")
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errors[0].title").value("Failed to deserialize request body: Unknown resource type found."))
                .andExpect(jsonPath("$.errors[0].source.pointer").value("/atomic:operations[1]/data/type"));
    }

    @Test
    void missingOperationCodeFailsValidation() throws Exception {
        postOperations("""
                {"atomic:operations": [{"ref": {"type": "workItems", "id": "1"}}]}""")
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errors[0].source.pointer").value("/atomic:operations[0]/op"));
    }

    @Test
    void malformedJsonIsRejected() throws Exception {
        postOperations("{\"atomic:operations\": [")
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errors[0].title").value("Failed to deserialize request body."));
    }

    @Test
    void tooManyOperationsIsRejected() throws Exception {
        options.setMaximumOperationsPerRequest(1);

        postOperations("""
                {"atomic:operations": [
                  {"op": "remove", "ref": {"type": "workItems", "id": "1"}},
                  {"op": "remove", "ref": {"type": "userAccounts", "id": "7"}}
                ]}""")
                .andExpect(status().isPayloadTooLarge())
                .andExpect(jsonPath("$.errors[0].source.pointer").value("/atomic:operations"));

        assertThat(store.find(WorkItem.class, 1)).isPresent();
    }

    @Test
    void queryStringIsNotAllowed() throws Exception {
        mockMvc.perform(post("/operations")
                        .param("include", "assignee")
                        .contentType(JsonApiMediaTypes.ATOMIC_OPERATIONS)
                        .content("{\"atomic:operations\": [{\"op\": \"remove\", \"ref\": {\"type\": \"workItems\", \"id\": \"1\"}}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0].detail").value("The parameter 'include' cannot be used at this endpoint."));
    }
}
