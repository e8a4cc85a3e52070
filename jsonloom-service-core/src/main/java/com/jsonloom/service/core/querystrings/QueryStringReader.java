package com.jsonloom.service.core.querystrings;

import com.jsonloom.core.configuration.JsonApiOptions;
import com.jsonloom.core.errors.ErrorObject;
import com.jsonloom.core.errors.InvalidQueryStringParameterException;
import com.jsonloom.core.errors.JsonApiException;
import com.jsonloom.service.core.queries.QuerySpecification;
import com.jsonloom.service.core.queries.expressions.ExpressionInScope;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Dispatches every query string parameter of a request to the reader that claims it and assembles
 * the resulting {@link QuerySpecification}. Failures of individual parameters are collected and
 * reported together.
 */
@Slf4j
public class QueryStringReader {
    private final JsonApiOptions options;
    private final RequestQueryStringAccessor queryStringAccessor;
    private final List<QueryStringParameterReader> parameterReaders;

    public QueryStringReader(
            JsonApiOptions options,
            RequestQueryStringAccessor queryStringAccessor,
            List<QueryStringParameterReader> parameterReaders) {
        this.options = options;
        this.queryStringAccessor = queryStringAccessor;
        this.parameterReaders = List.copyOf(parameterReaders);
    }

    public QuerySpecification readAll(Set<StandardQueryStringParameter> disabledParameters) {
        parameterReaders.forEach(QueryStringParameterReader::reset);

        List<JsonApiException> failures = new ArrayList<>();
        for (Map.Entry<String, List<String>> parameter : queryStringAccessor.getQuery().entrySet()) {
            String parameterName = parameter.getKey();
            if (!isWellFormedName(parameterName)) {
                failures.add(new InvalidQueryStringParameterException(
                        parameterName,
                        "Invalid query string parameter name.",
                        "Query string parameter name '" + parameterName + "' contains unbalanced or empty brackets."));
                throw combine(failures);
            }

            List<String> values = parameter.getValue() == null || parameter.getValue().isEmpty()
                    ? List.of("")
                    : parameter.getValue();
            QueryStringParameterReader reader = findReader(parameterName);
            for (String value : values) {
                try {
                    readParameter(reader, parameterName, value, disabledParameters);
                } catch (JsonApiException e) {
                    failures.add(e);
                }
            }
        }

        if (!failures.isEmpty()) {
            throw combine(failures);
        }
        return buildSpecification();
    }

    private void readParameter(
            QueryStringParameterReader reader,
            String parameterName,
            String parameterValue,
            Set<StandardQueryStringParameter> disabledParameters) {
        if (parameterValue == null || parameterValue.isEmpty()) {
            throw new InvalidQueryStringParameterException(
                    parameterName,
                    "Missing query string parameter value.",
                    "Missing value for '" + parameterName + "' query string parameter.");
        }

        if (reader != null) {
            log.debug(
                    "Query string parameter '{}' with value '{}' was accepted by {}.",
                    parameterName,
                    parameterValue,
                    reader.getClass().getSimpleName());

            if (!reader.isEnabled(disabledParameters)) {
                throw new InvalidQueryStringParameterException(
                        parameterName,
                        "Usage of one or more query string parameters is not allowed at the requested endpoint.",
                        "The parameter '" + parameterName + "' cannot be used at this endpoint.");
            }

            reader.read(parameterName, parameterValue);
            log.debug("Query string parameter '{}' was successfully read.", parameterName);
        } else if (!options.isAllowUnknownQueryStringParameters()) {
            throw new InvalidQueryStringParameterException(
                    parameterName,
                    "Unknown query string parameter.",
                    "Query string parameter '" + parameterName + "' is unknown. "
                            + "Set 'allowUnknownQueryStringParameters' to 'true' in options to ignore unknown parameters.");
        } else {
            log.debug("Ignoring unknown query string parameter '{}'.", parameterName);
        }
    }

    private QueryStringParameterReader findReader(String parameterName) {
        QueryStringParameterReader candidate = null;
        for (QueryStringParameterReader reader : parameterReaders) {
            if (reader.canRead(parameterName)) {
                if (reader.claimsExactly(parameterName)) {
                    return reader;
                }
                if (candidate == null) {
                    candidate = reader;
                }
            }
        }
        return candidate;
    }

    private QuerySpecification buildSpecification() {
        List<ExpressionInScope> constraints = new ArrayList<>();
        boolean ignoreNullValues = options.isSerializerIgnoreNullValues();
        boolean ignoreDefaultValues = options.isSerializerIgnoreDefaultValues();

        for (QueryStringParameterReader reader : parameterReaders) {
            if (reader instanceof QueryConstraintProvider provider) {
                constraints.addAll(provider.getConstraints());
            }
            if (reader instanceof NullsQueryStringParameterReader nulls) {
                ignoreNullValues = nulls.isIgnoreNullValues();
            }
            if (reader instanceof DefaultsQueryStringParameterReader defaults) {
                ignoreDefaultValues = defaults.isIgnoreDefaultValues();
            }
        }
        return new QuerySpecification(constraints, ignoreNullValues, ignoreDefaultValues);
    }

    private static JsonApiException combine(List<JsonApiException> failures) {
        if (failures.size() == 1) {
            return failures.get(0);
        }
        List<ErrorObject> errors = new ArrayList<>();
        failures.forEach(f -> errors.addAll(f.getErrors()));
        return new JsonApiException(errors, failures.get(0));
    }

    /**
     * Brackets must pair up, hold something, follow a base name and only be followed by another
     * bracket pair.
     */
    static boolean isWellFormedName(String parameterName) {
        if (parameterName.isEmpty()) {
            return true;
        }
        if (parameterName.charAt(0) == '[' || parameterName.charAt(0) == ']') {
            return false;
        }
        boolean open = false;
        boolean afterClose = false;
        int contentLength = 0;
        for (int i = 0; i < parameterName.length(); i++) {
            char ch = parameterName.charAt(i);
            if (ch == '[') {
                if (open) {
                    return false;
                }
                open = true;
                afterClose = false;
                contentLength = 0;
            } else if (ch == ']') {
                if (!open || contentLength == 0) {
                    return false;
                }
                open = false;
                afterClose = true;
            } else if (afterClose) {
                return false;
            } else if (open) {
                contentLength++;
            }
        }
        return !open;
    }
}
