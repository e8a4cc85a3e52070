package com.jsonloom.service.core.queries.expressions;

public record MatchTextExpression(
        ResourceFieldChainExpression targetAttribute, LiteralConstantExpression textValue, TextMatchKind matchKind)
        implements FilterExpression {

    @Override
    public String toString() {
        return matchKind.keyword() + "(" + targetAttribute + "," + textValue + ")";
    }
}
