package com.jsonloom.service.core.querystrings;

import com.jsonloom.service.core.queries.parsing.QueryParseException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Rewrites {@code filter[attr]=op:value} into filter function syntax. Values are split on commas
 * into separate conditions, except for {@code expr:}, {@code in:} and {@code nin:} values.
 */
public class LegacyFilterNotationConverter {
    private static final String PARAMETER_NAME_FILTER = "filter";
    private static final String EXPRESSION_PREFIX = "expr:";
    private static final String NOT_EQUALS_PREFIX = "ne:";
    private static final String IN_PREFIX = "in:";
    private static final String NOT_IN_PREFIX = "nin:";
    private static final String IS_NULL_PREFIX = "isnull:";
    private static final String IS_NOT_NULL_PREFIX = "isnotnull:";

    private static final Map<String, String> PREFIX_CONVERSION_TABLE = new LinkedHashMap<>();

    static {
        PREFIX_CONVERSION_TABLE.put("eq:", "equals");
        PREFIX_CONVERSION_TABLE.put("lt:", "lessThan");
        PREFIX_CONVERSION_TABLE.put("le:", "lessOrEqual");
        PREFIX_CONVERSION_TABLE.put("gt:", "greaterThan");
        PREFIX_CONVERSION_TABLE.put("ge:", "greaterOrEqual");
        PREFIX_CONVERSION_TABLE.put("like:", "contains");
    }

    /** A rewritten parameter: the name to read under and the filter function text. */
    public record ConvertedParameter(String parameterName, String parameterValue) {}

    public List<String> extractConditions(String parameterValue) {
        if (parameterValue.startsWith(EXPRESSION_PREFIX)
                || parameterValue.startsWith(IN_PREFIX)
                || parameterValue.startsWith(NOT_IN_PREFIX)) {
            return List.of(parameterValue);
        }
        return Arrays.asList(parameterValue.split(",", -1));
    }

    public ConvertedParameter convert(String parameterName, String parameterValue) {
        if (parameterValue.startsWith(EXPRESSION_PREFIX)) {
            return new ConvertedParameter(parameterName, parameterValue.substring(EXPRESSION_PREFIX.length()));
        }

        String attributeName = extractAttributeName(parameterName);

        for (Map.Entry<String, String> entry : PREFIX_CONVERSION_TABLE.entrySet()) {
            if (parameterValue.startsWith(entry.getKey())) {
                String value = parameterValue.substring(entry.getKey().length());
                return filter(entry.getValue() + "(" + attributeName + "," + quote(value) + ")");
            }
        }

        if (parameterValue.startsWith(NOT_EQUALS_PREFIX)) {
            String value = parameterValue.substring(NOT_EQUALS_PREFIX.length());
            return filter("not(equals(" + attributeName + "," + quote(value) + "))");
        }
        if (parameterValue.startsWith(IN_PREFIX)) {
            String values = quoteList(parameterValue.substring(IN_PREFIX.length()));
            return filter("any(" + attributeName + "," + values + ")");
        }
        if (parameterValue.startsWith(NOT_IN_PREFIX)) {
            String values = quoteList(parameterValue.substring(NOT_IN_PREFIX.length()));
            return filter("not(any(" + attributeName + "," + values + "))");
        }
        if (parameterValue.startsWith(IS_NULL_PREFIX)) {
            return filter("equals(" + attributeName + ",null)");
        }
        if (parameterValue.startsWith(IS_NOT_NULL_PREFIX)) {
            return filter("not(equals(" + attributeName + ",null))");
        }

        return filter("equals(" + attributeName + "," + quote(parameterValue) + ")");
    }

    private static ConvertedParameter filter(String expression) {
        return new ConvertedParameter(PARAMETER_NAME_FILTER, expression);
    }

    private static String extractAttributeName(String parameterName) {
        if (parameterName.startsWith(PARAMETER_NAME_FILTER + "[") && parameterName.endsWith("]")) {
            String attributeName =
                    parameterName.substring(PARAMETER_NAME_FILTER.length() + 1, parameterName.length() - 1);
            if (!attributeName.isEmpty()) {
                return attributeName;
            }
        }
        throw new QueryParseException("Expected field name between brackets in filter parameter name.");
    }

    private static String quoteList(String commaSeparated) {
        return Arrays.stream(commaSeparated.split(",", -1))
                .map(LegacyFilterNotationConverter::quote)
                .collect(Collectors.joining(","));
    }

    private static String quote(String value) {
        return "'" + value.replace("'", "''") + "'";
    }
}
