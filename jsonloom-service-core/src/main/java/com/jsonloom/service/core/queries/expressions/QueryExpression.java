package com.jsonloom.service.core.queries.expressions;

/**
 * Node of a parsed, validated query. Implementations are immutable values; {@link #toString()}
 * renders the node in query string syntax.
 */
public interface QueryExpression {}
