package com.jsonloom.service.core.queries.expressions;

/** A function that produces a value, usable as a comparison operand or a sort target. */
public interface FunctionExpression extends QueryExpression {}
