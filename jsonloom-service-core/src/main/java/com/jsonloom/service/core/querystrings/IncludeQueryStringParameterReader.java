package com.jsonloom.service.core.querystrings;

import com.jsonloom.core.configuration.JsonApiOptions;
import com.jsonloom.core.errors.InvalidQueryStringParameterException;
import com.jsonloom.core.resources.ResourceGraph;
import com.jsonloom.service.core.queries.expressions.ExpressionInScope;
import com.jsonloom.service.core.queries.expressions.IncludeExpression;
import com.jsonloom.service.core.queries.parsing.IncludeParser;
import com.jsonloom.service.core.queries.parsing.QueryParseException;
import com.jsonloom.service.core.queries.parsing.ResourceFieldChainResolver;
import com.jsonloom.service.core.request.JsonApiRequest;
import java.util.List;
import java.util.Set;

/** Reads {@code include=author,comments.author}. */
public class IncludeQueryStringParameterReader extends AbstractQueryStringParameterReader
        implements QueryConstraintProvider {
    private final IncludeParser includeParser = new IncludeParser(new ResourceFieldChainResolver());
    private IncludeExpression includeExpression = IncludeExpression.EMPTY;

    public IncludeQueryStringParameterReader(JsonApiRequest request, ResourceGraph resourceGraph, JsonApiOptions options) {
        super(request, resourceGraph, options);
    }

    @Override
    public boolean isEnabled(Set<StandardQueryStringParameter> disabledParameters) {
        return !StandardQueryStringParameter.isDisabled(disabledParameters, StandardQueryStringParameter.INCLUDE);
    }

    @Override
    public boolean canRead(String parameterName) {
        return "include".equals(parameterName);
    }

    @Override
    public boolean claimsExactly(String parameterName) {
        return canRead(parameterName);
    }

    @Override
    public void read(String parameterName, String parameterValue) {
        try {
            IncludeExpression parsed =
                    includeParser.parse(parameterValue, getRequestResource(), options.getMaximumIncludeDepth());
            includeExpression = includeExpression.merge(parsed);
        } catch (QueryParseException e) {
            throw new InvalidQueryStringParameterException(
                    parameterName, "The specified include is invalid.", e.getMessage(), e);
        }
    }

    @Override
    public List<ExpressionInScope> getConstraints() {
        return includeExpression.isEmpty() ? List.of() : List.of(new ExpressionInScope(null, includeExpression));
    }

    @Override
    public void reset() {
        includeExpression = IncludeExpression.EMPTY;
    }
}
