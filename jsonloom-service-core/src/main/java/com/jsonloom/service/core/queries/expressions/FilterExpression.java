package com.jsonloom.service.core.queries.expressions;

/** A boolean condition over resources. */
public interface FilterExpression extends QueryExpression {}
