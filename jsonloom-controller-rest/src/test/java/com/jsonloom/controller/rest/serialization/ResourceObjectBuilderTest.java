package com.jsonloom.controller.rest.serialization;

import static org.assertj.core.api.Assertions.assertThat;

import com.jsonloom.api.dto.Document;
import com.jsonloom.api.dto.ResourceIdentifierObject;
import com.jsonloom.api.dto.ResourceObject;
import com.jsonloom.core.configuration.JsonApiOptions;
import com.jsonloom.core.resources.ResourceGraph;
import com.jsonloom.core.resources.ResourceIdentity;
import com.jsonloom.service.core.fixtures.Fixtures;
import com.jsonloom.service.core.fixtures.UserAccount;
import com.jsonloom.service.core.fixtures.WorkItem;
import com.jsonloom.service.core.fixtures.WorkTag;
import com.jsonloom.service.core.hooks.ReturnedResources;
import com.jsonloom.service.core.queries.QuerySpecification;
import com.jsonloom.service.core.querystrings.QueryStringReaderFactory;
import com.jsonloom.service.core.request.JsonApiRequest;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ResourceObjectBuilderTest {

    private final ResourceGraph graph = Fixtures.graph();
    private final ResourceObjectBuilder builder = new ResourceObjectBuilder(graph);

    private QuerySpecification query(JsonApiOptions options, String... namesAndValues) {
        return new QueryStringReaderFactory(graph, options)
                .create(JsonApiRequest.forCollection(graph.getResourceContext(WorkItem.class)), Fixtures.query(namesAndValues))
                .readAll(Set.of());
    }

    @Test
    void writesAllViewableAttributesAndRelationshipIdentifiers() {
        UserAccount jane = new UserAccount(7L, "Jane", "Doe");
        WorkItem item = new WorkItem(1, "Fix login");
        item.setAssignee(jane);
        item.getTags().add(new WorkTag(3, "ui"));

        ResourceObject object = builder.build(item, QuerySpecification.empty(Fixtures.options()));

        assertThat(object.getType()).isEqualTo("workItems");
        assertThat(object.getId()).isEqualTo("1");
        assertThat(object.getAttributes())
                .containsKeys("description", "priority", "durationInHours", "archived")
                .containsEntry("priority", null);
        assertThat(object.getRelationships().get("assignee").getData())
                .isEqualTo(new ResourceIdentifierObject("userAccounts", "7", null));
        assertThat(object.getRelationships().get("tags").getData())
                .isEqualTo(List.of(new ResourceIdentifierObject("workTags", "3", null)));
        assertThat(object.getRelationships().get("parent").getData()).isNull();
    }

    @Test
    void omitsNullAndDefaultValuesWhenConfigured() {
        JsonApiOptions options = Fixtures.options();
        options.setSerializerIgnoreNullValues(true);
        options.setSerializerIgnoreDefaultValues(true);
        WorkItem item = new WorkItem(1, "Fix login");

        ResourceObject object = builder.build(item, QuerySpecification.empty(options));

        assertThat(object.getAttributes()).containsOnlyKeys("description");
    }

    @Test
    void nullsParameterOverridesConfiguredDefault() {
        JsonApiOptions options = Fixtures.options();
        options.setAllowQueryStringOverrideForSerializerNullValueHandling(true);
        WorkItem item = new WorkItem(1, "Fix login");

        ResourceObject object = builder.build(item, query(options, "nulls", "false"));

        assertThat(object.getAttributes()).doesNotContainKeys("priority", "durationInHours").containsKey("archived");
    }

    @Test
    void unsavedResourceIsIdentifiedByLocalId() {
        WorkItem item = new WorkItem(null, "Draft");
        item.setLocalId("draft-1");

        ResourceObject object = builder.build(item, QuerySpecification.empty(Fixtures.options()));

        assertThat(object.getId()).isNull();
        assertThat(object.getLid()).isEqualTo("draft-1");
    }

    @Test
    void includedResourcesFollowNestedChainsOnce() {
        UserAccount jane = new UserAccount(7L, "Jane", "Doe");
        WorkItem first = new WorkItem(1, "Fix login");
        WorkItem second = new WorkItem(2, "Write docs");
        first.setAssignee(jane);
        second.setAssignee(jane);
        second.setParent(first);
        jane.getAssignedItems().add(first);
        jane.getAssignedItems().add(second);

        Document document = builder.buildCollection(
                List.of(second), query(Fixtures.options(), "include", "assignee.assignedItems,parent"));

        assertThat(document.getIncluded())
                .extracting(o -> o.getType() + ":" + o.getId())
                .containsExactly("userAccounts:7", "workItems:1");
    }

    @Test
    void hiddenResourcesAreLeftOutOfRelationshipsAndIncluded() {
        UserAccount jane = new UserAccount(7L, "Jane", "Doe");
        WorkTag visible = new WorkTag(3, "ui");
        WorkTag hidden = new WorkTag(4, "internal");
        WorkItem item = new WorkItem(1, "Fix login");
        item.setAssignee(jane);
        item.getTags().add(visible);
        item.getTags().add(hidden);
        ReturnedResources<WorkItem> returned = new ReturnedResources<>(
                List.of(item), Set.of(ResourceIdentity.of(jane), ResourceIdentity.of(hidden)));

        Document document = builder.buildSingle(returned, query(Fixtures.options(), "include", "assignee,tags"));

        ResourceObject data = (ResourceObject) document.getData();
        assertThat(data.getRelationships().get("assignee").getData()).isNull();
        assertThat(data.getRelationships().get("tags").getData())
                .isEqualTo(List.of(new ResourceIdentifierObject("workTags", "3", null)));
        assertThat(document.getIncluded())
                .extracting(o -> o.getType() + ":" + o.getId())
                .containsExactly("workTags:3");
        assertThat(item.getTags()).containsExactly(visible, hidden);
        assertThat(item.getAssignee()).isSameAs(jane);
    }
}
