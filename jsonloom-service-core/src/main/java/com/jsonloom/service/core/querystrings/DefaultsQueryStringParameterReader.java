package com.jsonloom.service.core.querystrings;

import com.jsonloom.core.configuration.JsonApiOptions;
import com.jsonloom.core.errors.InvalidQueryStringParameterException;
import com.jsonloom.core.resources.ResourceGraph;
import com.jsonloom.service.core.request.JsonApiRequest;
import java.util.Set;

/** Reads {@code defaults=true|false}: whether attributes holding default values are written. */
public class DefaultsQueryStringParameterReader extends AbstractQueryStringParameterReader {
    private boolean ignoreDefaultValues;

    public DefaultsQueryStringParameterReader(JsonApiRequest request, ResourceGraph resourceGraph, JsonApiOptions options) {
        super(request, resourceGraph, options);
        this.ignoreDefaultValues = options.isSerializerIgnoreDefaultValues();
    }

    @Override
    public boolean isEnabled(Set<StandardQueryStringParameter> disabledParameters) {
        return options.isAllowQueryStringOverrideForSerializerDefaultValueHandling()
                && !StandardQueryStringParameter.isDisabled(disabledParameters, StandardQueryStringParameter.DEFAULTS);
    }

    @Override
    public boolean canRead(String parameterName) {
        return "defaults".equals(parameterName);
    }

    @Override
    public boolean claimsExactly(String parameterName) {
        return canRead(parameterName);
    }

    @Override
    public void read(String parameterName, String parameterValue) {
        if ("true".equalsIgnoreCase(parameterValue)) {
            ignoreDefaultValues = false;
        } else if ("false".equalsIgnoreCase(parameterValue)) {
            ignoreDefaultValues = true;
        } else {
            throw new InvalidQueryStringParameterException(
                    parameterName,
                    "The specified defaults is invalid.",
                    "The value '" + parameterValue + "' must be 'true' or 'false'.");
        }
    }

    public boolean isIgnoreDefaultValues() {
        return ignoreDefaultValues;
    }

    @Override
    public void reset() {
        ignoreDefaultValues = options.isSerializerIgnoreDefaultValues();
    }
}
