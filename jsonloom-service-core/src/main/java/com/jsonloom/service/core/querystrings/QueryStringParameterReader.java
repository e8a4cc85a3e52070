package com.jsonloom.service.core.querystrings;

import java.util.Set;

/**
 * Reads one family of query string parameters. Instances belong to a single request.
 */
public interface QueryStringParameterReader {

    /** Whether this reader handles the parameter with this name. */
    boolean canRead(String parameterName);

    /** Whether the name is claimed without brackets, which wins over bracketed claims of other readers. */
    default boolean claimsExactly(String parameterName) {
        return false;
    }

    /** Whether the parameter family is allowed at the current endpoint. */
    boolean isEnabled(Set<StandardQueryStringParameter> disabledParameters);

    /**
     * Reads one parameter value.
     *
     * @throws com.jsonloom.core.errors.InvalidQueryStringParameterException when the value is invalid
     */
    void read(String parameterName, String parameterValue);

    /** Discards everything read so far. */
    void reset();
}
