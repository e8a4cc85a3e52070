package com.jsonloom.service.core.queries.expressions;

/**
 * A quoted literal. {@code typedValue} holds the text converted to the type of the attribute it is
 * compared against.
 */
public record LiteralConstantExpression(Object typedValue, String text) implements QueryExpression {

    public LiteralConstantExpression(String text) {
        this(text, text);
    }

    @Override
    public String toString() {
        return "'" + text.replace("'", "''") + "'";
    }
}
