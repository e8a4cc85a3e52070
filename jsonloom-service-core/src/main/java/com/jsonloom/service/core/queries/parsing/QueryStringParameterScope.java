package com.jsonloom.service.core.queries.parsing;

import com.jsonloom.service.core.queries.expressions.ResourceFieldChainExpression;

/** A parameter name split into its base name and optional bracketed scope. */
public record QueryStringParameterScope(String parameterName, ResourceFieldChainExpression scope) {}
