package com.jsonloom.service.core.querystrings;

import com.jsonloom.core.configuration.JsonApiOptions;
import com.jsonloom.core.errors.InvalidQueryStringParameterException;
import com.jsonloom.core.resources.ResourceGraph;
import com.jsonloom.service.core.queries.expressions.ExpressionInScope;
import com.jsonloom.service.core.queries.expressions.ResourceFieldChainExpression;
import com.jsonloom.service.core.queries.expressions.SortElementExpression;
import com.jsonloom.service.core.queries.expressions.SortExpression;
import com.jsonloom.service.core.queries.parsing.FieldChainRequirements;
import com.jsonloom.service.core.queries.parsing.QueryParseException;
import com.jsonloom.service.core.queries.parsing.QueryStringParameterScope;
import com.jsonloom.service.core.queries.parsing.QueryStringParameterScopeParser;
import com.jsonloom.service.core.queries.parsing.ResourceFieldChainResolver;
import com.jsonloom.service.core.queries.parsing.SortParser;
import com.jsonloom.service.core.request.JsonApiRequest;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Reads {@code sort} and {@code sort[to-many chain]}. */
public class SortQueryStringParameterReader extends AbstractQueryStringParameterReader
        implements QueryConstraintProvider {
    private final QueryStringParameterScopeParser scopeParser;
    private final SortParser sortParser;
    private final Map<ResourceFieldChainExpression, List<SortElementExpression>> sortsPerScope = new LinkedHashMap<>();

    public SortQueryStringParameterReader(JsonApiRequest request, ResourceGraph resourceGraph, JsonApiOptions options) {
        super(request, resourceGraph, options);
        ResourceFieldChainResolver resolver = new ResourceFieldChainResolver();
        this.scopeParser = new QueryStringParameterScopeParser(resolver, FieldChainRequirements.ENDS_IN_TO_MANY);
        this.sortParser = new SortParser(resolver);
    }

    @Override
    public boolean isEnabled(Set<StandardQueryStringParameter> disabledParameters) {
        return !StandardQueryStringParameter.isDisabled(disabledParameters, StandardQueryStringParameter.SORT);
    }

    @Override
    public boolean canRead(String parameterName) {
        return "sort".equals(parameterName) || (parameterName.startsWith("sort[") && parameterName.endsWith("]"));
    }

    @Override
    public boolean claimsExactly(String parameterName) {
        return "sort".equals(parameterName);
    }

    @Override
    public void read(String parameterName, String parameterValue) {
        try {
            QueryStringParameterScope parameterScope = scopeParser.parse(parameterName, getRequestResource());
            ResourceFieldChainExpression scope = parameterScope.scope();
            if (scope == null) {
                assertIsCollectionRequest();
            }
            SortExpression sort = sortParser.parse(parameterValue, getResourceContextForScope(scope));

            List<SortElementExpression> elements = new ArrayList<>(sortsPerScope.getOrDefault(scope, List.of()));
            elements.addAll(sort.elements());
            SortParser.assertNoDuplicates(elements);
            sortsPerScope.put(scope, elements);
        } catch (QueryParseException e) {
            throw new InvalidQueryStringParameterException(
                    parameterName, "The specified sort is invalid.", e.getMessage(), e);
        }
    }

    @Override
    public List<ExpressionInScope> getConstraints() {
        List<ExpressionInScope> constraints = new ArrayList<>();
        sortsPerScope.forEach((scope, elements) -> constraints.add(new ExpressionInScope(scope, new SortExpression(elements))));
        return constraints;
    }

    @Override
    public void reset() {
        sortsPerScope.clear();
    }
}
