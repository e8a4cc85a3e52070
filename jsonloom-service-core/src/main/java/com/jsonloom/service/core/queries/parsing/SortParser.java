package com.jsonloom.service.core.queries.parsing;

import com.jsonloom.core.resources.ResourceContext;
import com.jsonloom.core.resources.ResourceFieldAttribute;
import com.jsonloom.core.resources.annotations.AttrCapabilities;
import com.jsonloom.service.core.queries.expressions.CountExpression;
import com.jsonloom.service.core.queries.expressions.ResourceFieldChainExpression;
import com.jsonloom.service.core.queries.expressions.SortElementExpression;
import com.jsonloom.service.core.queries.expressions.SortExpression;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Parses {@code -lastName,author.name,count(tags)}. */
public class SortParser extends QueryExpressionParser {
    private ResourceContext resourceContextInScope;

    public SortParser(ResourceFieldChainResolver chainResolver) {
        super(chainResolver);
    }

    public SortExpression parse(String source, ResourceContext resourceContextInScope) {
        this.resourceContextInScope = resourceContextInScope;
        tokenize(source);
        SortExpression expression = parseSort();
        assertTokenStackIsEmpty();
        return expression;
    }

    protected SortExpression parseSort() {
        List<SortElementExpression> elements = new ArrayList<>();
        elements.add(parseSortElement());
        while (peekKind(TokenKind.COMMA)) {
            eatSingleCharacterToken(TokenKind.COMMA);
            elements.add(parseSortElement());
        }
        assertNoDuplicates(elements);
        return new SortExpression(elements);
    }

    protected SortElementExpression parseSortElement() {
        boolean ascending = true;
        if (peekKind(TokenKind.MINUS)) {
            tokenStack.pop();
            ascending = false;
        }

        if (peekText("count")) {
            eatText("count");
            eatSingleCharacterToken(TokenKind.OPEN_PARENTHESIS);
            ResourceFieldChainExpression target = parseFieldChain(FieldChainRequirements.ENDS_IN_TO_MANY, null);
            eatSingleCharacterToken(TokenKind.CLOSE_PARENTHESIS);
            return new SortElementExpression(new CountExpression(target), ascending);
        }

        String errorMessage = ascending ? "-, count function or field name expected." : "Count function or field name expected.";
        ResourceFieldChainExpression target = parseFieldChain(FieldChainRequirements.ENDS_IN_ATTRIBUTE, errorMessage);
        return new SortElementExpression(target, ascending);
    }

    /** Fails when the same target appears more than once, regardless of direction. */
    public static void assertNoDuplicates(List<SortElementExpression> elements) {
        Set<Object> targets = new HashSet<>();
        for (SortElementExpression element : elements) {
            if (!targets.add(element.target())) {
                throw new QueryParseException("Duplicate sort element '" + element.target() + "'.");
            }
        }
    }

    @Override
    protected List<ResourceFieldAttribute> onResolveFieldChain(String path, FieldChainRequirements requirements) {
        if (requirements == FieldChainRequirements.ENDS_IN_TO_MANY) {
            return chainResolver.resolveToOneChainEndingInToMany(resourceContextInScope, path);
        }
        if (requirements == FieldChainRequirements.ENDS_IN_ATTRIBUTE) {
            return chainResolver.resolveToOneChainEndingInAttribute(
                    resourceContextInScope, path, AttrCapabilities.ALLOW_SORT);
        }
        throw new IllegalStateException("Unexpected chain requirement " + requirements);
    }
}
