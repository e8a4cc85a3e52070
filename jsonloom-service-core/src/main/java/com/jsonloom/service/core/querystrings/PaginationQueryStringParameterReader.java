package com.jsonloom.service.core.querystrings;

import com.jsonloom.core.configuration.JsonApiOptions;
import com.jsonloom.core.errors.InvalidQueryStringParameterException;
import com.jsonloom.core.resources.ResourceFieldAttribute;
import com.jsonloom.core.resources.ResourceGraph;
import com.jsonloom.service.core.queries.expressions.ExpressionInScope;
import com.jsonloom.service.core.queries.expressions.PaginationExpression;
import com.jsonloom.service.core.queries.expressions.ResourceFieldChainExpression;
import com.jsonloom.service.core.queries.parsing.QueryParseException;
import com.jsonloom.service.core.queries.parsing.ResourceFieldChainResolver;
import com.jsonloom.service.core.request.JsonApiRequest;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads {@code page[size]}, {@code page[number]} and their scoped forms
 * {@code page[to-many chain][size]} and {@code page[to-many chain][number]}.
 */
public class PaginationQueryStringParameterReader extends AbstractQueryStringParameterReader
        implements QueryConstraintProvider {
    private static final String SIZE = "size";
    private static final String NUMBER = "number";

    private final ResourceFieldChainResolver chainResolver = new ResourceFieldChainResolver();
    private final Map<ResourceFieldChainExpression, PageSettings> settingsPerScope = new LinkedHashMap<>();

    public PaginationQueryStringParameterReader(
            JsonApiRequest request, ResourceGraph resourceGraph, JsonApiOptions options) {
        super(request, resourceGraph, options);
    }

    @Override
    public boolean isEnabled(Set<StandardQueryStringParameter> disabledParameters) {
        return !StandardQueryStringParameter.isDisabled(disabledParameters, StandardQueryStringParameter.PAGE);
    }

    @Override
    public boolean canRead(String parameterName) {
        return "page".equals(parameterName) || parameterName.startsWith("page[");
    }

    @Override
    public void read(String parameterName, String parameterValue) {
        try {
            List<String> segments = bracketSegments(parameterName);
            ResourceFieldChainExpression scope = null;
            String key;
            if (segments.size() == 1) {
                key = segments.get(0);
                assertIsCollectionRequest();
            } else if (segments.size() == 2) {
                List<ResourceFieldAttribute> chain = chainResolver.resolveToManyChain(getRequestResource(), segments.get(0));
                scope = new ResourceFieldChainExpression(chain);
                key = segments.get(1);
            } else {
                throw unknownKey(parameterName);
            }

            PageSettings settings = settingsPerScope.computeIfAbsent(scope, s -> new PageSettings());
            if (SIZE.equals(key)) {
                settings.size = parsePageSize(parameterValue);
            } else if (NUMBER.equals(key)) {
                settings.number = parsePageNumber(parameterValue);
            } else {
                throw unknownKey(parameterName);
            }
        } catch (QueryParseException e) {
            throw new InvalidQueryStringParameterException(
                    parameterName, "The specified paging is invalid.", e.getMessage(), e);
        }
    }

    private int parsePageSize(String value) {
        int size = parsePositive(value, "Page size");
        Integer maximum = options.getMaximumPageSize();
        if (maximum != null && size > maximum) {
            throw new QueryParseException("Page size cannot be higher than " + maximum + ".");
        }
        return size;
    }

    private int parsePageNumber(String value) {
        int number = parsePositive(value, "Page number");
        Integer maximum = options.getMaximumPageNumber();
        if (maximum != null && number > maximum) {
            throw new QueryParseException("Page number cannot be higher than " + maximum + ".");
        }
        return number;
    }

    private static int parsePositive(String value, String label) {
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new QueryParseException(label + " must be a positive integer.", e);
        }
        if (parsed < 1) {
            throw new QueryParseException(label + " must be a positive integer.");
        }
        return parsed;
    }

    private static List<String> bracketSegments(String parameterName) {
        List<String> segments = new ArrayList<>();
        int position = "page".length();
        while (position < parameterName.length()) {
            int close = parameterName.indexOf(']', position);
            if (parameterName.charAt(position) != '[' || close < 0) {
                throw unknownKey(parameterName);
            }
            segments.add(parameterName.substring(position + 1, close));
            position = close + 1;
        }
        if (segments.isEmpty()) {
            throw unknownKey(parameterName);
        }
        return segments;
    }

    private static QueryParseException unknownKey(String parameterName) {
        return new QueryParseException(
                "'" + parameterName + "' is not a valid paging parameter. Use 'page[size]' or 'page[number]'.");
    }

    @Override
    public List<ExpressionInScope> getConstraints() {
        List<ExpressionInScope> constraints = new ArrayList<>();
        if (request.collection() && !settingsPerScope.containsKey(null)) {
            constraints.add(new ExpressionInScope(null, new PaginationExpression(1, defaultPageSize())));
        }
        settingsPerScope.forEach((scope, settings) -> constraints.add(new ExpressionInScope(
                scope,
                new PaginationExpression(
                        settings.number != null ? settings.number : 1,
                        settings.size != null ? settings.size : defaultPageSize()))));
        return constraints;
    }

    private Integer defaultPageSize() {
        return options.getDefaultPageSize() > 0 ? options.getDefaultPageSize() : null;
    }

    @Override
    public void reset() {
        settingsPerScope.clear();
    }

    private static final class PageSettings {
        private Integer size;
        private Integer number;
    }
}
