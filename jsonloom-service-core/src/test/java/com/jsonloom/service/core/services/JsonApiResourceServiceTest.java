package com.jsonloom.service.core.services;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.jsonloom.core.errors.RelationshipNotFoundException;
import com.jsonloom.core.errors.ResourceNotFoundException;
import com.jsonloom.core.resources.ResourceGraph;
import com.jsonloom.service.core.fixtures.Fixtures;
import com.jsonloom.service.core.fixtures.InMemoryDataStore;
import com.jsonloom.service.core.fixtures.InMemoryServices;
import com.jsonloom.service.core.fixtures.UserAccount;
import com.jsonloom.service.core.fixtures.WorkItem;
import com.jsonloom.service.core.hooks.DefaultResourceHookExecutor;
import com.jsonloom.service.core.hooks.NoResourceHookExecutor;
import com.jsonloom.service.core.hooks.ResourceHook;
import com.jsonloom.service.core.hooks.ResourceHookExecutor;
import com.jsonloom.service.core.hooks.ResourceHooksDefinition;
import com.jsonloom.service.core.hooks.ResourceHooksRegistry;
import com.jsonloom.service.core.hooks.ResourcePipeline;
import com.jsonloom.service.core.hooks.ReturnedResources;
import com.jsonloom.service.core.queries.QuerySpecification;
import com.jsonloom.service.core.queries.expressions.IncludeExpression;
import com.jsonloom.service.core.querystrings.QueryStringReaderFactory;
import com.jsonloom.service.core.request.JsonApiRequest;
import com.jsonloom.service.core.request.TargetedFields;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JsonApiResourceServiceTest {

    private final ResourceGraph graph = Fixtures.graph();
    private InMemoryDataStore store;
    private ResourceService<WorkItem, Integer> workItems;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        store = new InMemoryDataStore();
        store.save(new WorkItem(1, "Fix login"));
        store.save(new WorkItem(2, "Write docs"));
        store.save(new WorkItem(3, "Fix logout"));
        workItems = (ResourceService<WorkItem, Integer>) InMemoryServices.registry(
                        graph, store, NoResourceHookExecutor.INSTANCE)
                .find(WorkItem.class)
                .orElseThrow();
    }

    private QuerySpecification query(String... namesAndValues) {
        return new QueryStringReaderFactory(graph, Fixtures.options())
                .create(JsonApiRequest.forCollection(graph.getResourceContext(WorkItem.class)), Fixtures.query(namesAndValues))
                .readAll(Set.of());
    }

    @Test
    void getAllAppliesFilterSortAndPagination() {
        List<WorkItem> items = workItems.getAll(
                        query("filter", "startsWith(description,'Fix')", "sort", "-description", "page[size]", "1"))
                .resources();

        assertThat(items).extracting(WorkItem::getDescription).containsExactly("Fix logout");
    }

    @Test
    void pageBeyondLastReturnsNothing() {
        List<WorkItem> items =
                workItems.getAll(query("page[size]", "10", "page[number]", "2147483647")).resources();

        assertThat(items).isEmpty();
    }

    @Test
    void getByIdOfMissingResourceFails() {
        assertThatThrownBy(() -> workItems.getById(42, QuerySpecification.empty(Fixtures.options())))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessageContaining("Resource of type 'workItems' with ID '42' does not exist.");
    }

    @Test
    void deleteOfMissingResourceFails() {
        assertThatThrownBy(() -> workItems.delete(42)).isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void deleteRemovesResource() {
        workItems.delete(2);

        assertFalse(store.find(WorkItem.class, 2).isPresent());
    }

    @Test
    void unknownRelationshipFails() {
        assertThatThrownBy(() -> workItems.setRelationship(1, "owner", null))
                .isInstanceOf(RelationshipNotFoundException.class);
        assertThatThrownBy(() -> workItems.addToToManyRelationship(1, "assignee", Set.of()))
                .isInstanceOf(RelationshipNotFoundException.class);
    }

    @Test
    void setRelationshipResolvesStoredResources() {
        UserAccount stored = store.save(new UserAccount(7L, "Jane", "Doe"));

        workItems.setRelationship(1, "assignee", new UserAccount(7L, null, null));

        assertEquals(stored, store.find(WorkItem.class, 1).orElseThrow().getAssignee());
        assertEquals(stored, workItems.getRelationship(1, "assignee"));
    }

    @Test
    void updateCopiesOnlyTargetedFields() {
        WorkItem changes = new WorkItem(1, "Fix login page");
        changes.setDurationInHours(5L);
        TargetedFields targeted = new TargetedFields(
                Set.of(graph.getResourceContext(WorkItem.class).findAttribute("description").orElseThrow()), Set.of());

        WorkItem updated = workItems.update(1, changes, targeted);

        assertEquals("Fix login page", updated.getDescription());
        assertEquals(null, updated.getDurationInHours());
    }

    @Test
    @SuppressWarnings("unchecked")
    void readsRunHooksAroundRepository() {
        ResourceHookExecutor hooks = mock(ResourceHookExecutor.class);
        when(hooks.onReturn(any(List.class), any(), any())).thenReturn(ReturnedResources.of(List.of()));
        ResourceService<WorkItem, Integer> service =
                (ResourceService<WorkItem, Integer>) InMemoryServices.registry(graph, store, hooks)
                        .find(WorkItem.class)
                        .orElseThrow();

        assertThatThrownBy(() -> service.getById(1, QuerySpecification.empty(Fixtures.options())))
                .isInstanceOf(ResourceNotFoundException.class);

        verify(hooks).beforeRead(eq(graph.getResourceContext(WorkItem.class)), eq(ResourcePipeline.GET_SINGLE), eq("1"), any());
        verify(hooks).afterRead(anyCollection(), eq(ResourcePipeline.GET_SINGLE), eq(IncludeExpression.EMPTY));
    }

    @Test
    void readWithoutIncludeDoesNotRunRelatedTypeHooks() {
        UserAccount assignee = assignFirstItem();
        AssigneeHooks assigneeHooks = new AssigneeHooks();
        ResourceService<WorkItem, Integer> service = serviceWithHooks(assigneeHooks);

        ReturnedResources<WorkItem> returned = service.getAll(QuerySpecification.empty(Fixtures.options()));

        assertThat(returned.resources()).hasSize(3);
        assertThat(returned.hidden()).isEmpty();
        assertThat(assigneeHooks.afterReadIncluded).isEmpty();
        assertSame(assignee, store.find(WorkItem.class, 1).orElseThrow().getAssignee());
    }

    @Test
    void includedResourcesFilteredOnReturnStayInStore() {
        UserAccount assignee = assignFirstItem();
        AssigneeHooks assigneeHooks = new AssigneeHooks();
        ResourceService<WorkItem, Integer> service = serviceWithHooks(assigneeHooks);

        ReturnedResources<WorkItem> returned = service.getAll(query("include", "assignee"));

        assertThat(assigneeHooks.afterReadIncluded).containsExactly(true);
        assertThat(returned.resources()).hasSize(3);
        assertTrue(returned.isHidden(assignee));
        assertSame(assignee, store.find(WorkItem.class, 1).orElseThrow().getAssignee());
    }

    @Test
    void relationshipFilteredOnReturnIsReportedEmpty() {
        UserAccount assignee = assignFirstItem();
        ResourceService<WorkItem, Integer> service = serviceWithHooks(new AssigneeHooks());

        assertNull(service.getRelationship(1, "assignee"));
        assertSame(assignee, store.find(WorkItem.class, 1).orElseThrow().getAssignee());
    }

    private UserAccount assignFirstItem() {
        UserAccount assignee = store.save(new UserAccount(7L, "Jane", "Doe"));
        store.find(WorkItem.class, 1).orElseThrow().setAssignee(assignee);
        return assignee;
    }

    @SuppressWarnings("unchecked")
    private ResourceService<WorkItem, Integer> serviceWithHooks(ResourceHooksDefinition<?> definition) {
        ResourceHookExecutor executor =
                new DefaultResourceHookExecutor(new ResourceHooksRegistry().register(definition), graph);
        return (ResourceService<WorkItem, Integer>) InMemoryServices.registry(graph, store, executor)
                .find(WorkItem.class)
                .orElseThrow();
    }

    static class AssigneeHooks extends ResourceHooksDefinition<UserAccount> {
        final List<Boolean> afterReadIncluded = new ArrayList<>();

        AssigneeHooks() {
            super(UserAccount.class, ResourceHook.AFTER_READ, ResourceHook.ON_RETURN);
        }

        @Override
        public void afterRead(Set<UserAccount> resources, ResourcePipeline pipeline, boolean isIncluded) {
            afterReadIncluded.add(isIncluded);
        }

        @Override
        public Set<UserAccount> onReturn(Set<UserAccount> resources, ResourcePipeline pipeline) {
            resources.clear();
            return resources;
        }
    }
}
