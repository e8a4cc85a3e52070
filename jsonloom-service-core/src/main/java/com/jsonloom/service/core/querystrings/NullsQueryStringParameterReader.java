package com.jsonloom.service.core.querystrings;

import com.jsonloom.core.configuration.JsonApiOptions;
import com.jsonloom.core.errors.InvalidQueryStringParameterException;
import com.jsonloom.core.resources.ResourceGraph;
import com.jsonloom.service.core.request.JsonApiRequest;
import java.util.Set;

/** Reads {@code nulls=true|false}: whether attributes holding null are written. */
public class NullsQueryStringParameterReader extends AbstractQueryStringParameterReader {
    private boolean ignoreNullValues;

    public NullsQueryStringParameterReader(JsonApiRequest request, ResourceGraph resourceGraph, JsonApiOptions options) {
        super(request, resourceGraph, options);
        this.ignoreNullValues = options.isSerializerIgnoreNullValues();
    }

    @Override
    public boolean isEnabled(Set<StandardQueryStringParameter> disabledParameters) {
        return options.isAllowQueryStringOverrideForSerializerNullValueHandling()
                && !StandardQueryStringParameter.isDisabled(disabledParameters, StandardQueryStringParameter.NULLS);
    }

    @Override
    public boolean canRead(String parameterName) {
        return "nulls".equals(parameterName);
    }

    @Override
    public boolean claimsExactly(String parameterName) {
        return canRead(parameterName);
    }

    @Override
    public void read(String parameterName, String parameterValue) {
        if ("true".equalsIgnoreCase(parameterValue)) {
            ignoreNullValues = false;
        } else if ("false".equalsIgnoreCase(parameterValue)) {
            ignoreNullValues = true;
        } else {
            throw new InvalidQueryStringParameterException(
                    parameterName,
                    "The specified nulls is invalid.",
                    "The value '" + parameterValue + "' must be 'true' or 'false'.");
        }
    }

    public boolean isIgnoreNullValues() {
        return ignoreNullValues;
    }

    @Override
    public void reset() {
        ignoreNullValues = options.isSerializerIgnoreNullValues();
    }
}
