package com.jsonloom.service.core.queries;

import com.jsonloom.core.configuration.JsonApiOptions;
import com.jsonloom.core.resources.ResourceContext;
import com.jsonloom.service.core.queries.expressions.ExpressionInScope;
import com.jsonloom.service.core.queries.expressions.FilterExpression;
import com.jsonloom.service.core.queries.expressions.IncludeExpression;
import com.jsonloom.service.core.queries.expressions.PaginationExpression;
import com.jsonloom.service.core.queries.expressions.ResourceFieldChainExpression;
import com.jsonloom.service.core.queries.expressions.SortExpression;
import com.jsonloom.service.core.queries.expressions.SparseFieldSetExpression;
import com.jsonloom.service.core.queries.expressions.SparseFieldTableExpression;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Validated result of reading all query string parameters of one request.
 *
 * @param constraints typed expressions, each bound to the scope it applies to
 * @param ignoreNullValues whether null attributes are omitted from the response
 * @param ignoreDefaultValues whether default-valued attributes are omitted from the response
 */
public record QuerySpecification(
        List<ExpressionInScope> constraints, boolean ignoreNullValues, boolean ignoreDefaultValues) {

    public QuerySpecification {
        constraints = List.copyOf(constraints);
    }

    /** A specification without constraints that uses the configured serializer defaults. */
    public static QuerySpecification empty(JsonApiOptions options) {
        return new QuerySpecification(
                List.of(), options.isSerializerIgnoreNullValues(), options.isSerializerIgnoreDefaultValues());
    }

    public Optional<FilterExpression> getFilter(ResourceFieldChainExpression scope) {
        return find(scope, FilterExpression.class);
    }

    public Optional<SortExpression> getSort(ResourceFieldChainExpression scope) {
        return find(scope, SortExpression.class);
    }

    public Optional<PaginationExpression> getPagination(ResourceFieldChainExpression scope) {
        return find(scope, PaginationExpression.class);
    }

    public Optional<FilterExpression> getPrimaryFilter() {
        return getFilter(null);
    }

    public Optional<SortExpression> getPrimarySort() {
        return getSort(null);
    }

    public Optional<PaginationExpression> getPrimaryPagination() {
        return getPagination(null);
    }

    public IncludeExpression getInclude() {
        return find(null, IncludeExpression.class).orElse(IncludeExpression.EMPTY);
    }

    public Optional<SparseFieldSetExpression> getSparseFieldSet(ResourceContext resourceContext) {
        return find(null, SparseFieldTableExpression.class)
                .map(table -> table.table().get(resourceContext));
    }

    private <T> Optional<T> find(ResourceFieldChainExpression scope, Class<T> expressionType) {
        return constraints.stream()
                .filter(c -> Objects.equals(c.scope(), scope) && expressionType.isInstance(c.expression()))
                .map(c -> expressionType.cast(c.expression()))
                .findFirst();
    }
}
