package com.jsonloom.core.configuration;

/**
 * Global options. Plain mutable bean so it can be bound from {@code jsonloom.*} properties; treat it
 * as read-only once the application has started.
 */
public class JsonApiOptions {

    /** Invoke registered resource hooks from the resource services. */
    private boolean enableResourceHooks = false;

    /** Accept {@code filter[attr]=eq:value} style filters in addition to the function syntax. */
    private boolean enableLegacyFilterNotation = false;

    /** Ignore query string parameters no reader claims instead of failing the request. */
    private boolean allowUnknownQueryStringParameters = false;

    private boolean allowQueryStringOverrideForSerializerNullValueHandling = false;
    private boolean allowQueryStringOverrideForSerializerDefaultValueHandling = false;

    /** Omit attributes whose value is null from response documents. */
    private boolean serializerIgnoreNullValues = false;

    /** Omit attributes holding their type's default value from response documents. */
    private boolean serializerIgnoreDefaultValues = false;

    /** Page size used when the request specifies none. 0 disables paging. */
    private int defaultPageSize = 10;

    /** Upper bound for {@code page[size]}; null means unbounded. */
    private Integer maximumPageSize;

    /** Upper bound for {@code page[number]}; null means unbounded. */
    private Integer maximumPageNumber;

    /** Maximum number of relationships in one include chain; null means unbounded. */
    private Integer maximumIncludeDepth;

    /** Maximum number of operations in an atomic-operations request. 0 disables the check. */
    private int maximumOperationsPerRequest = 10;

    private boolean includeExceptionStackTraceInErrors = false;

    public boolean isEnableResourceHooks() {
        return enableResourceHooks;
    }

    public void setEnableResourceHooks(boolean enableResourceHooks) {
        this.enableResourceHooks = enableResourceHooks;
    }

    public boolean isEnableLegacyFilterNotation() {
        return enableLegacyFilterNotation;
    }

    public void setEnableLegacyFilterNotation(boolean enableLegacyFilterNotation) {
        this.enableLegacyFilterNotation = enableLegacyFilterNotation;
    }

    public boolean isAllowUnknownQueryStringParameters() {
        return allowUnknownQueryStringParameters;
    }

    public void setAllowUnknownQueryStringParameters(boolean allowUnknownQueryStringParameters) {
        this.allowUnknownQueryStringParameters = allowUnknownQueryStringParameters;
    }

    public boolean isAllowQueryStringOverrideForSerializerNullValueHandling() {
        return allowQueryStringOverrideForSerializerNullValueHandling;
    }

    public void setAllowQueryStringOverrideForSerializerNullValueHandling(boolean value) {
        this.allowQueryStringOverrideForSerializerNullValueHandling = value;
    }

    public boolean isAllowQueryStringOverrideForSerializerDefaultValueHandling() {
        return allowQueryStringOverrideForSerializerDefaultValueHandling;
    }

    public void setAllowQueryStringOverrideForSerializerDefaultValueHandling(boolean value) {
        this.allowQueryStringOverrideForSerializerDefaultValueHandling = value;
    }

    public boolean isSerializerIgnoreNullValues() {
        return serializerIgnoreNullValues;
    }

    public void setSerializerIgnoreNullValues(boolean serializerIgnoreNullValues) {
        this.serializerIgnoreNullValues = serializerIgnoreNullValues;
    }

    public boolean isSerializerIgnoreDefaultValues() {
        return serializerIgnoreDefaultValues;
    }

    public void setSerializerIgnoreDefaultValues(boolean serializerIgnoreDefaultValues) {
        this.serializerIgnoreDefaultValues = serializerIgnoreDefaultValues;
    }

    public int getDefaultPageSize() {
        return defaultPageSize;
    }

    public void setDefaultPageSize(int defaultPageSize) {
        this.defaultPageSize = defaultPageSize;
    }

    public Integer getMaximumPageSize() {
        return maximumPageSize;
    }

    public void setMaximumPageSize(Integer maximumPageSize) {
        this.maximumPageSize = maximumPageSize;
    }

    public Integer getMaximumPageNumber() {
        return maximumPageNumber;
    }

    public void setMaximumPageNumber(Integer maximumPageNumber) {
        this.maximumPageNumber = maximumPageNumber;
    }

    public Integer getMaximumIncludeDepth() {
        return maximumIncludeDepth;
    }

    public void setMaximumIncludeDepth(Integer maximumIncludeDepth) {
        this.maximumIncludeDepth = maximumIncludeDepth;
    }

    public int getMaximumOperationsPerRequest() {
        return maximumOperationsPerRequest;
    }

    public void setMaximumOperationsPerRequest(int maximumOperationsPerRequest) {
        this.maximumOperationsPerRequest = maximumOperationsPerRequest;
    }

    public boolean isIncludeExceptionStackTraceInErrors() {
        return includeExceptionStackTraceInErrors;
    }

    public void setIncludeExceptionStackTraceInErrors(boolean includeExceptionStackTraceInErrors) {
        this.includeExceptionStackTraceInErrors = includeExceptionStackTraceInErrors;
    }
}
