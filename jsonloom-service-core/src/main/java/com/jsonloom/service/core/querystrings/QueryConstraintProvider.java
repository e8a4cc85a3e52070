package com.jsonloom.service.core.querystrings;

import com.jsonloom.service.core.queries.expressions.ExpressionInScope;
import java.util.List;

/** A reader that contributes typed expressions to the query. */
public interface QueryConstraintProvider {

    List<ExpressionInScope> getConstraints();
}
