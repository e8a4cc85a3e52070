package com.jsonloom.service.core.querystrings;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.jsonloom.core.configuration.JsonApiOptions;
import com.jsonloom.core.errors.InvalidQueryStringParameterException;
import com.jsonloom.core.resources.ResourceGraph;
import com.jsonloom.service.core.fixtures.Fixtures;
import com.jsonloom.service.core.queries.expressions.CountExpression;
import com.jsonloom.service.core.queries.expressions.ExpressionInScope;
import com.jsonloom.service.core.queries.expressions.SortElementExpression;
import com.jsonloom.service.core.queries.expressions.SortExpression;
import com.jsonloom.service.core.request.JsonApiRequest;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class SortQueryStringParameterReaderTest {

    private final ResourceGraph graph = Fixtures.graph();
    private final JsonApiOptions options = Fixtures.options();

    private SortQueryStringParameterReader collectionReader() {
        return new SortQueryStringParameterReader(
                JsonApiRequest.forCollection(graph.getResourceContext("workItems")), graph, options);
    }

    @Test
    void descendingPrefixYieldsSingleDescendingElement() {
        SortQueryStringParameterReader reader = collectionReader();
        reader.read("sort", "-description");

        List<ExpressionInScope> constraints = reader.getConstraints();
        assertEquals(1, constraints.size());
        SortExpression sort = (SortExpression) constraints.get(0).expression();
        assertEquals(1, sort.elements().size());
        SortElementExpression element = sort.elements().get(0);
        assertFalse(element.ascending());
        assertEquals("description", element.target().toString());
    }

    @Test
    void keepsOrderAndDirectionOfMultipleElements() {
        SortQueryStringParameterReader reader = collectionReader();
        reader.read("sort", "priority,-durationInHours,assignee.lastName");

        SortExpression sort = (SortExpression) reader.getConstraints().get(0).expression();
        assertThat(sort.elements()).extracting(SortElementExpression::ascending).containsExactly(true, false, true);
        assertThat(sort.elements())
                .extracting(e -> e.target().toString())
                .containsExactly("priority", "durationInHours", "assignee.lastName");
    }

    @Test
    void supportsCountOfToManyRelationship() {
        SortQueryStringParameterReader reader = collectionReader();
        reader.read("sort", "-count(subscribers)");

        SortExpression sort = (SortExpression) reader.getConstraints().get(0).expression();
        assertTrue(sort.elements().get(0).target() instanceof CountExpression);
    }

    @Test
    void scopedSortAppliesToRelationshipChain() {
        SortQueryStringParameterReader reader = collectionReader();
        reader.read("sort[subscribers]", "firstName");

        ExpressionInScope constraint = reader.getConstraints().get(0);
        assertEquals("subscribers", constraint.scope().toString());
    }

    @Test
    void rejectsAttributeWithoutSortCapability() {
        SortQueryStringParameterReader reader = collectionReader();

        assertThatThrownBy(() -> reader.read("sort", "archived"))
                .isInstanceOf(InvalidQueryStringParameterException.class)
                .satisfies(e -> {
                    InvalidQueryStringParameterException ex = (InvalidQueryStringParameterException) e;
                    assertEquals("sort", ex.getParameterName());
                    assertEquals("The specified sort is invalid.", ex.getErrors().get(0).getTitle());
                    assertEquals("Sorting on attribute 'archived' is not allowed.", ex.getErrors().get(0).getDetail());
                });
    }

    @Test
    void rejectsDuplicateElements() {
        SortQueryStringParameterReader reader = collectionReader();

        assertThatThrownBy(() -> reader.read("sort", "description,-description"))
                .isInstanceOf(InvalidQueryStringParameterException.class)
                .hasMessageContaining("Duplicate sort element 'description'.");
    }

    @Test
    void rejectsUnknownAttribute() {
        SortQueryStringParameterReader reader = collectionReader();

        assertThatThrownBy(() -> reader.read("sort", "doesNotExist"))
                .isInstanceOf(InvalidQueryStringParameterException.class)
                .hasMessageContaining("'doesNotExist'");
    }

    @Test
    void rejectsTopLevelSortOnSingleResource() {
        SortQueryStringParameterReader reader = new SortQueryStringParameterReader(
                JsonApiRequest.forSingle(graph.getResourceContext("workItems"), "1"), graph, options);

        assertThatThrownBy(() -> reader.read("sort", "description"))
                .isInstanceOf(InvalidQueryStringParameterException.class)
                .hasMessageContaining("can only be used on a collection of resources");
    }

    @Test
    void isDisabledBySortOrAll() {
        SortQueryStringParameterReader reader = collectionReader();

        assertFalse(reader.isEnabled(Set.of(StandardQueryStringParameter.SORT)));
        assertFalse(reader.isEnabled(Set.of(StandardQueryStringParameter.ALL)));
        assertTrue(reader.isEnabled(Set.of(StandardQueryStringParameter.FILTER)));
    }
}
