package com.jsonloom.service.core.querystrings;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.jsonloom.core.errors.InvalidQueryStringParameterException;
import com.jsonloom.core.resources.ResourceContext;
import com.jsonloom.core.resources.ResourceFieldAttribute;
import com.jsonloom.core.resources.ResourceGraph;
import com.jsonloom.service.core.fixtures.Fixtures;
import com.jsonloom.service.core.queries.expressions.SparseFieldTableExpression;
import com.jsonloom.service.core.request.JsonApiRequest;
import org.junit.jupiter.api.Test;

class SparseFieldSetQueryStringParameterReaderTest {

    private final ResourceGraph graph = Fixtures.graph();
    private final ResourceContext workItems = graph.getResourceContext("workItems");

    private SparseFieldSetQueryStringParameterReader reader() {
        return new SparseFieldSetQueryStringParameterReader(
                JsonApiRequest.forCollection(workItems), graph, Fixtures.options());
    }

    @Test
    void restrictsTypeToListedField() {
        SparseFieldSetQueryStringParameterReader reader = reader();
        reader.read("fields[workItems]", "description");

        SparseFieldTableExpression table = (SparseFieldTableExpression) reader.getConstraints().get(0).expression();
        assertThat(table.table().get(workItems).fields())
                .extracting(ResourceFieldAttribute::getPublicName)
                .containsExactly("description");
    }

    @Test
    void repeatedTypeAccumulatesFields() {
        SparseFieldSetQueryStringParameterReader reader = reader();
        reader.read("fields[workItems]", "description");
        reader.read("fields[workItems]", "priority,assignee");
        reader.read("fields[userAccounts]", "lastName");

        SparseFieldTableExpression table = (SparseFieldTableExpression) reader.getConstraints().get(0).expression();
        assertThat(table.table().get(workItems).fields())
                .extracting(ResourceFieldAttribute::getPublicName)
                .containsExactly("description", "priority", "assignee");
        assertThat(table.table()).hasSize(2);
    }

    @Test
    void rejectsUnknownResourceType() {
        assertThatThrownBy(() -> reader().read("fields[doesNotExist]", "id"))
                .isInstanceOf(InvalidQueryStringParameterException.class)
                .hasMessageContaining("Resource type 'doesNotExist' does not exist.");
    }

    @Test
    void rejectsUnknownField() {
        assertThatThrownBy(() -> reader().read("fields[workItems]", "unknown"))
                .isInstanceOf(InvalidQueryStringParameterException.class)
                .hasMessageContaining("The specified fieldset is invalid.");
    }
}
