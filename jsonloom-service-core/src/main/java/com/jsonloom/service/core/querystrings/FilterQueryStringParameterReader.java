package com.jsonloom.service.core.querystrings;

import com.jsonloom.core.configuration.JsonApiOptions;
import com.jsonloom.core.errors.InvalidQueryStringParameterException;
import com.jsonloom.core.resources.ResourceGraph;
import com.jsonloom.service.core.queries.expressions.ExpressionInScope;
import com.jsonloom.service.core.queries.expressions.FilterExpression;
import com.jsonloom.service.core.queries.expressions.LogicalExpression;
import com.jsonloom.service.core.queries.expressions.ResourceFieldChainExpression;
import com.jsonloom.service.core.queries.parsing.FieldChainRequirements;
import com.jsonloom.service.core.queries.parsing.FilterParser;
import com.jsonloom.service.core.queries.parsing.QueryParseException;
import com.jsonloom.service.core.queries.parsing.QueryStringParameterScope;
import com.jsonloom.service.core.queries.parsing.QueryStringParameterScopeParser;
import com.jsonloom.service.core.queries.parsing.ResourceFieldChainResolver;
import com.jsonloom.service.core.request.JsonApiRequest;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads {@code filter} and {@code filter[to-many chain]}. Filters in the same scope are combined
 * with {@code or}.
 */
public class FilterQueryStringParameterReader extends AbstractQueryStringParameterReader
        implements QueryConstraintProvider {
    private static final LegacyFilterNotationConverter LEGACY_CONVERTER = new LegacyFilterNotationConverter();

    private final QueryStringParameterScopeParser scopeParser;
    private final FilterParser filterParser;
    private final Map<ResourceFieldChainExpression, List<FilterExpression>> filtersPerScope = new LinkedHashMap<>();

    public FilterQueryStringParameterReader(JsonApiRequest request, ResourceGraph resourceGraph, JsonApiOptions options) {
        super(request, resourceGraph, options);
        ResourceFieldChainResolver resolver = new ResourceFieldChainResolver();
        this.scopeParser = new QueryStringParameterScopeParser(resolver, FieldChainRequirements.ENDS_IN_TO_MANY);
        this.filterParser = new FilterParser(resolver);
    }

    @Override
    public boolean isEnabled(Set<StandardQueryStringParameter> disabledParameters) {
        return !StandardQueryStringParameter.isDisabled(disabledParameters, StandardQueryStringParameter.FILTER);
    }

    @Override
    public boolean canRead(String parameterName) {
        return "filter".equals(parameterName) || (parameterName.startsWith("filter[") && parameterName.endsWith("]"));
    }

    @Override
    public boolean claimsExactly(String parameterName) {
        return "filter".equals(parameterName);
    }

    @Override
    public void read(String parameterName, String parameterValue) {
        List<String> values = options.isEnableLegacyFilterNotation()
                ? LEGACY_CONVERTER.extractConditions(parameterValue)
                : List.of(parameterValue);
        for (String value : values) {
            readSingleValue(parameterName, value);
        }
    }

    private void readSingleValue(String parameterName, String parameterValue) {
        try {
            String name = parameterName;
            String value = parameterValue;
            if (options.isEnableLegacyFilterNotation()) {
                LegacyFilterNotationConverter.ConvertedParameter converted =
                        LEGACY_CONVERTER.convert(parameterName, parameterValue);
                name = converted.parameterName();
                value = converted.parameterValue();
            }

            ResourceFieldChainExpression scope = getScope(name);
            FilterExpression filter = filterParser.parse(value, getResourceContextForScope(scope));
            filtersPerScope.computeIfAbsent(scope, key -> new ArrayList<>()).add(filter);
        } catch (QueryParseException e) {
            throw new InvalidQueryStringParameterException(
                    parameterName, "The specified filter is invalid.", e.getMessage(), e);
        }
    }

    private ResourceFieldChainExpression getScope(String parameterName) {
        QueryStringParameterScope parameterScope = scopeParser.parse(parameterName, getRequestResource());
        if (parameterScope.scope() == null) {
            assertIsCollectionRequest();
        }
        return parameterScope.scope();
    }

    @Override
    public List<ExpressionInScope> getConstraints() {
        List<ExpressionInScope> constraints = new ArrayList<>();
        filtersPerScope.forEach((scope, filters) -> constraints.add(new ExpressionInScope(scope, LogicalExpression.or(filters))));
        return constraints;
    }

    @Override
    public void reset() {
        filtersPerScope.clear();
    }
}
