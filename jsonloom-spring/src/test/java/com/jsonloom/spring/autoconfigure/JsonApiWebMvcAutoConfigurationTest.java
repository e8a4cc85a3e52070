package com.jsonloom.spring.autoconfigure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jsonloom.controller.rest.JsonApiMediaTypes;
import com.jsonloom.core.resources.Identifiable;
import com.jsonloom.core.resources.ResourceGraph;
import com.jsonloom.service.core.atomic.OperationsTransactionFactory;
import com.jsonloom.service.core.fixtures.InMemoryDataStore;
import com.jsonloom.service.core.fixtures.InMemoryResourceRepository;
import com.jsonloom.service.core.fixtures.UserAccount;
import com.jsonloom.service.core.fixtures.WorkItem;
import com.jsonloom.service.core.fixtures.WorkTag;
import com.jsonloom.service.core.hooks.ResourceHook;
import com.jsonloom.service.core.hooks.ResourceHookExecutor;
import com.jsonloom.service.core.hooks.ResourceHooksDefinition;
import com.jsonloom.service.core.hooks.ResourcePipeline;
import com.jsonloom.service.core.services.JsonApiResourceService;
import com.jsonloom.spring.transaction.SpringOperationsTransactionFactory;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Function;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.ImportAutoConfiguration;
import org.springframework.boot.autoconfigure.http.HttpMessageConvertersAutoConfiguration;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.autoconfigure.web.servlet.WebMvcAutoConfiguration;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.AbstractPlatformTransactionManager;
import org.springframework.transaction.support.DefaultTransactionStatus;

@SpringBootTest(
        classes = JsonApiWebMvcAutoConfigurationTest.TestConfig.class,
        properties = {"jsonloom.enable-resource-hooks=true", "jsonloom.maximum-operations-per-request=2"})
@ImportAutoConfiguration(
        classes = {
            JacksonAutoConfiguration.class,
            HttpMessageConvertersAutoConfiguration.class,
            ValidationAutoConfiguration.class,
            WebMvcAutoConfiguration.class,
            JsonApiAutoConfiguration.class,
            JsonApiWebMvcAutoConfiguration.class
        })
@AutoConfigureMockMvc
class JsonApiWebMvcAutoConfigurationTest {

    @Configuration
    static class TestConfig {
        @Bean
        InMemoryDataStore inMemoryDataStore() {
            InMemoryDataStore store = new InMemoryDataStore();
            store.save(new UserAccount(7L, "Jane", "Doe"));
            store.save(new WorkItem(1, "Fix login"));
            WorkItem archived = new WorkItem(2, "Old report");
            archived.setArchived(true);
            store.save(archived);
            return store;
        }

        @Bean
        ResourceGraphContributor fixtureResources() {
            return builder -> builder.add(WorkItem.class).add(UserAccount.class).add(WorkTag.class);
        }

        @Bean
        JsonApiResourceService<WorkItem, Integer> workItemService(
                InMemoryDataStore store, ResourceGraph graph, ResourceHookExecutor hookExecutor) {
            return service(WorkItem.class, Long::intValue, store, graph, hookExecutor);
        }

        @Bean
        JsonApiResourceService<UserAccount, Long> userAccountService(
                InMemoryDataStore store, ResourceGraph graph, ResourceHookExecutor hookExecutor) {
            return service(UserAccount.class, Function.identity(), store, graph, hookExecutor);
        }

        @Bean
        JsonApiResourceService<WorkTag, Integer> workTagService(
                InMemoryDataStore store, ResourceGraph graph, ResourceHookExecutor hookExecutor) {
            return service(WorkTag.class, Long::intValue, store, graph, hookExecutor);
        }

        @Bean
        ResourceHooksDefinition<WorkItem> hideArchivedWorkItems() {
            return new HideArchivedWorkItems();
        }

        @Bean
        CountingTransactionManager transactionManager() {
            return new CountingTransactionManager();
        }

        private static <T extends Identifiable<ID>, ID> JsonApiResourceService<T, ID> service(
                Class<T> resourceClass,
                Function<Long, ID> idFactory,
                InMemoryDataStore store,
                ResourceGraph graph,
                ResourceHookExecutor hookExecutor) {
            return new JsonApiResourceService<>(
                    new InMemoryResourceRepository<>(resourceClass, store, idFactory), graph, hookExecutor);
        }
    }

    static class HideArchivedWorkItems extends ResourceHooksDefinition<WorkItem> {
        HideArchivedWorkItems() {
            super(WorkItem.class, ResourceHook.ON_RETURN);
        }

        @Override
        public Set<WorkItem> onReturn(Set<WorkItem> resources, ResourcePipeline pipeline) {
            Set<WorkItem> visible = new LinkedHashSet<>();
            for (WorkItem item : resources) {
                if (!item.isArchived()) {
                    visible.add(item);
                }
            }
            return visible;
        }
    }

    static class CountingTransactionManager extends AbstractPlatformTransactionManager {
        private int commits;

        @Override
        protected Object doGetTransaction() {
            return new Object();
        }

        @Override
        protected void doBegin(Object transaction, TransactionDefinition definition) {}

        @Override
        protected void doCommit(DefaultTransactionStatus status) {
            commits++;
        }

        @Override
        protected void doRollback(DefaultTransactionStatus status) {}

        int getCommits() {
            return commits;
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private OperationsTransactionFactory transactionFactory;

    @Autowired
    private CountingTransactionManager transactionManager;

    @Test
    void resourceEndpointsAreExposed() throws Exception {
        mockMvc.perform(get("/workItems").param("sort", "description"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(JsonApiMediaTypes.JSON_API))
                .andExpect(jsonPath("$.data", hasSize(1)))
                .andExpect(jsonPath("$.data[0].id").value("1"));
    }

    @Test
    void registeredHooksFilterReturnedResources() throws Exception {
        mockMvc.perform(get("/workItems/2"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errors[0].status").value("404"));
    }

    @Test
    void unknownQueryParametersAreRejected() throws Exception {
        mockMvc.perform(get("/userAccounts").param("foo", "bar"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0].source.parameter").value("foo"));
    }

    @Test
    void atomicOperationsRunInApplicationTransaction() throws Exception {
        assertThat(transactionFactory).isInstanceOf(SpringOperationsTransactionFactory.class);
        int commitsBefore = transactionManager.getCommits();

        mockMvc.perform(post("/operations")
                        .contentType(JsonApiMediaTypes.ATOMIC_OPERATIONS)
                        .content("""
                                {"atomic:operations": [
                                  {"op": "add", "data": {"type": "userAccounts",
                                    "attributes": {"firstName": "John", "lastName": "Smith"}}}
                                ]}"""))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$['atomic:results'][0].data.type").value("userAccounts"))
                .andExpect(jsonPath("$['atomic:results'][0].data.attributes.firstName").value("John"));

        assertThat(transactionManager.getCommits()).isEqualTo(commitsBefore + 1);
    }

    @Test
    void operationLimitIsBoundFromProperties() throws Exception {
        mockMvc.perform(post("/operations")
                        .contentType(JsonApiMediaTypes.ATOMIC_OPERATIONS)
                        .content("""
                                {"atomic:operations": [
                                  {"op": "remove", "ref": {"type": "workTags", "id": "1"}},
                                  {"op": "remove", "ref": {"type": "workTags", "id": "2"}},
                                  {"op": "remove", "ref": {"type": "workTags", "id": "3"}}
                                ]}"""))
                .andExpect(status().isPayloadTooLarge());
    }
}
