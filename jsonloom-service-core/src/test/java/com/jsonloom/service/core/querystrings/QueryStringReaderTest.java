package com.jsonloom.service.core.querystrings;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.jsonloom.core.configuration.JsonApiOptions;
import com.jsonloom.core.errors.ErrorObject;
import com.jsonloom.core.errors.JsonApiException;
import com.jsonloom.core.resources.ResourceGraph;
import com.jsonloom.service.core.fixtures.Fixtures;
import com.jsonloom.service.core.queries.QuerySpecification;
import com.jsonloom.service.core.request.JsonApiRequest;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class QueryStringReaderTest {

    private final ResourceGraph graph = Fixtures.graph();

    private QueryStringReader reader(JsonApiOptions options, RequestQueryStringAccessor accessor) {
        return new QueryStringReaderFactory(graph, options)
                .create(JsonApiRequest.forCollection(graph.getResourceContext("workItems")), accessor);
    }

    private static JsonApiException readFailure(QueryStringReader reader, Set<StandardQueryStringParameter> disabled) {
        try {
            reader.readAll(disabled);
        } catch (JsonApiException e) {
            return e;
        }
        throw new AssertionError("Expected query string to be rejected");
    }

    @Test
    void assemblesConstraintsFromAllReaders() {
        QueryStringReader reader = reader(
                Fixtures.options(),
                Fixtures.query(
                        "include", "assignee",
                        "filter", "equals(description,'x')",
                        "sort", "-description",
                        "page[size]", "3",
                        "fields[workItems]", "description"));

        QuerySpecification query = reader.readAll(Set.of());

        assertEquals("assignee", query.getInclude().toString());
        assertTrue(query.getPrimaryFilter().isPresent());
        assertFalse(query.getPrimarySort().orElseThrow().elements().get(0).ascending());
        assertEquals(3, query.getPrimaryPagination().orElseThrow().pageSize());
        assertTrue(query.getSparseFieldSet(graph.getResourceContext("workItems")).isPresent());
    }

    @Test
    void readingTwiceYieldsEqualResult() {
        QueryStringReader reader = reader(
                Fixtures.options(), Fixtures.query("sort", "priority", "filter", "has(tags)", "include", "tags"));

        QuerySpecification first = reader.readAll(Set.of());
        QuerySpecification second = reader.readAll(Set.of());

        assertEquals(first, second);
    }

    @Test
    void unknownParameterFailsUnlessAllowed() {
        JsonApiException failure = readFailure(reader(Fixtures.options(), Fixtures.query("foo", "bar")), Set.of());
        ErrorObject error = failure.getErrors().get(0);
        assertEquals("Unknown query string parameter.", error.getTitle());
        assertEquals("foo", error.getSource().parameter());

        JsonApiOptions options = Fixtures.options();
        options.setAllowUnknownQueryStringParameters(true);
        QuerySpecification query = reader(options, Fixtures.query("foo", "bar")).readAll(Set.of());
        assertThat(query.getPrimaryFilter()).isEmpty();
    }

    @Test
    void missingValueIsRejected() {
        Map<String, List<String>> raw = new LinkedHashMap<>();
        raw.put("sort", List.of());

        JsonApiException failure = readFailure(reader(Fixtures.options(), () -> raw), Set.of());

        assertEquals("Missing query string parameter value.", failure.getErrors().get(0).getTitle());
        assertEquals("Missing value for 'sort' query string parameter.", failure.getErrors().get(0).getDetail());
    }

    @Test
    void disabledParameterIsRejected() {
        JsonApiException failure =
                readFailure(reader(Fixtures.options(), Fixtures.query("sort", "description")), Set.of(StandardQueryStringParameter.SORT));

        assertEquals(
                "Usage of one or more query string parameters is not allowed at the requested endpoint.",
                failure.getErrors().get(0).getTitle());
        assertEquals(400, failure.getErrors().get(0).getStatusCode());
    }

    @Test
    void allDisablesEveryStandardParameter() {
        JsonApiException failure = readFailure(
                reader(Fixtures.options(), Fixtures.query("include", "assignee", "page[size]", "1")),
                Set.of(StandardQueryStringParameter.ALL));

        assertEquals(2, failure.getErrors().size());
    }

    @Test
    void failuresOfDifferentParametersAreCollected() {
        JsonApiException failure = readFailure(
                reader(Fixtures.options(), Fixtures.query("sort", "unknown", "include", "unknown", "page[size]", "2")),
                Set.of());

        assertThat(failure.getErrors())
                .extracting(e -> e.getSource().parameter())
                .containsExactly("sort", "include");
    }

    @Test
    void malformedParameterNameStopsReading() {
        JsonApiException failure = readFailure(
                reader(Fixtures.options(), Fixtures.query("sort", "unknown", "filter[", "x", "include", "unknown")),
                Set.of());

        assertThat(failure.getErrors())
                .extracting(ErrorObject::getTitle)
                .containsExactly("The specified sort is invalid.", "Invalid query string parameter name.");
    }

    @Test
    void nullsOverrideRequiresOption() {
        readFailure(reader(Fixtures.options(), Fixtures.query("nulls", "true")), Set.of());

        JsonApiOptions options = Fixtures.options();
        options.setAllowQueryStringOverrideForSerializerNullValueHandling(true);
        options.setSerializerIgnoreNullValues(true);
        QuerySpecification query = reader(options, Fixtures.query("nulls", "true")).readAll(Set.of());
        assertFalse(query.ignoreNullValues());
    }

    @Test
    void defaultsOverrideFlipsIgnoreDefaultValues() {
        JsonApiOptions options = Fixtures.options();
        options.setAllowQueryStringOverrideForSerializerDefaultValueHandling(true);

        QuerySpecification query = reader(options, Fixtures.query("defaults", "false")).readAll(Set.of());

        assertTrue(query.ignoreDefaultValues());
    }

    @Test
    void recognizesWellFormedNames() {
        assertTrue(QueryStringReader.isWellFormedName("sort"));
        assertTrue(QueryStringReader.isWellFormedName("page[subscribers][size]"));
        assertFalse(QueryStringReader.isWellFormedName("filter["));
        assertFalse(QueryStringReader.isWellFormedName("filter[]"));
        assertFalse(QueryStringReader.isWellFormedName("[sort]"));
        assertFalse(QueryStringReader.isWellFormedName("page[size]x"));
    }
}
