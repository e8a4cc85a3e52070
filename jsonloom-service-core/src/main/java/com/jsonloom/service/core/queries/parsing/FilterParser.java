package com.jsonloom.service.core.queries.parsing;

import com.jsonloom.core.resources.AttrAttribute;
import com.jsonloom.core.resources.ResourceContext;
import com.jsonloom.core.resources.ResourceFieldAttribute;
import com.jsonloom.core.resources.RuntimeTypeConverter;
import com.jsonloom.core.resources.annotations.AttrCapabilities;
import com.jsonloom.service.core.queries.expressions.AnyExpression;
import com.jsonloom.service.core.queries.expressions.CollectionNotEmptyExpression;
import com.jsonloom.service.core.queries.expressions.ComparisonExpression;
import com.jsonloom.service.core.queries.expressions.ComparisonOperator;
import com.jsonloom.service.core.queries.expressions.CountExpression;
import com.jsonloom.service.core.queries.expressions.FilterExpression;
import com.jsonloom.service.core.queries.expressions.LiteralConstantExpression;
import com.jsonloom.service.core.queries.expressions.LogicalExpression;
import com.jsonloom.service.core.queries.expressions.LogicalOperator;
import com.jsonloom.service.core.queries.expressions.MatchTextExpression;
import com.jsonloom.service.core.queries.expressions.NotExpression;
import com.jsonloom.service.core.queries.expressions.NullConstantExpression;
import com.jsonloom.service.core.queries.expressions.QueryExpression;
import com.jsonloom.service.core.queries.expressions.ResourceFieldChainExpression;
import com.jsonloom.service.core.queries.expressions.TextMatchKind;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses filter functions, for example
 * {@code and(equals(status,'done'),greaterThan(count(tags),'2'))}. Literals are converted to the
 * type of the attribute they are compared against.
 */
public class FilterParser extends QueryExpressionParser {
    private ResourceContext resourceContextInScope;

    public FilterParser(ResourceFieldChainResolver chainResolver) {
        super(chainResolver);
    }

    public FilterExpression parse(String source, ResourceContext resourceContextInScope) {
        this.resourceContextInScope = resourceContextInScope;
        tokenize(source);
        FilterExpression expression = parseFilter();
        assertTokenStackIsEmpty();
        return expression;
    }

    protected FilterExpression parseFilter() {
        Token next = tokenStack.peek();
        if (next != null && next.kind() == TokenKind.TEXT) {
            String keyword = next.value();
            switch (keyword) {
                case "not":
                    return parseNot();
                case "and":
                    return parseLogical(LogicalOperator.AND);
                case "or":
                    return parseLogical(LogicalOperator.OR);
                case "any":
                    return parseAny();
                case "has":
                    return parseHas();
                default:
                    break;
            }
            ComparisonOperator comparison = ComparisonOperator.fromKeyword(keyword);
            if (comparison != null) {
                return parseComparison(comparison);
            }
            TextMatchKind matchKind = TextMatchKind.fromKeyword(keyword);
            if (matchKind != null) {
                return parseTextMatch(matchKind);
            }
        }
        throw new QueryParseException("Filter function expected.");
    }

    private NotExpression parseNot() {
        eatText("not");
        eatSingleCharacterToken(TokenKind.OPEN_PARENTHESIS);
        FilterExpression child = parseFilter();
        eatSingleCharacterToken(TokenKind.CLOSE_PARENTHESIS);
        return new NotExpression(child);
    }

    private LogicalExpression parseLogical(LogicalOperator operator) {
        eatText(operator.keyword());
        eatSingleCharacterToken(TokenKind.OPEN_PARENTHESIS);

        List<FilterExpression> terms = new ArrayList<>();
        terms.add(parseFilter());
        eatSingleCharacterToken(TokenKind.COMMA);
        terms.add(parseFilter());
        while (peekKind(TokenKind.COMMA)) {
            eatSingleCharacterToken(TokenKind.COMMA);
            terms.add(parseFilter());
        }

        eatSingleCharacterToken(TokenKind.CLOSE_PARENTHESIS);
        return new LogicalExpression(operator, terms);
    }

    private ComparisonExpression parseComparison(ComparisonOperator operator) {
        eatText(operator.keyword());
        eatSingleCharacterToken(TokenKind.OPEN_PARENTHESIS);

        // only equals() may compare a to-one relationship, and only against null
        FieldChainRequirements leftRequirements = operator == ComparisonOperator.EQUALS
                ? FieldChainRequirements.ENDS_IN_ATTRIBUTE_OR_TO_ONE
                : FieldChainRequirements.ENDS_IN_ATTRIBUTE;
        QueryExpression left = parseCountOrField(leftRequirements);
        eatSingleCharacterToken(TokenKind.COMMA);
        QueryExpression right = parseCountOrConstantOrNullOrField();
        eatSingleCharacterToken(TokenKind.CLOSE_PARENTHESIS);

        if (left instanceof ResourceFieldChainExpression leftChain
                && leftChain.getTargetRelationship() != null
                && !(right instanceof NullConstantExpression)) {
            onResolveFieldChain(leftChain.toString(), FieldChainRequirements.ENDS_IN_ATTRIBUTE);
        }

        return new ComparisonExpression(operator, left, convertRightOperand(left, right));
    }

    private MatchTextExpression parseTextMatch(TextMatchKind matchKind) {
        eatText(matchKind.keyword());
        eatSingleCharacterToken(TokenKind.OPEN_PARENTHESIS);
        ResourceFieldChainExpression target = parseFieldChain(FieldChainRequirements.ENDS_IN_ATTRIBUTE, null);
        AttrAttribute attribute = target.getTargetAttribute();
        if (RuntimeTypeConverter.wrap(attribute.getPropertyType()) != String.class) {
            throw new QueryParseException("Attribute '" + attribute.getPublicName()
                    + "' must be a text attribute to be used in '" + matchKind.keyword() + "'.");
        }
        eatSingleCharacterToken(TokenKind.COMMA);
        LiteralConstantExpression text = parseConstant();
        eatSingleCharacterToken(TokenKind.CLOSE_PARENTHESIS);
        return new MatchTextExpression(target, text, matchKind);
    }

    private AnyExpression parseAny() {
        eatText("any");
        eatSingleCharacterToken(TokenKind.OPEN_PARENTHESIS);
        ResourceFieldChainExpression target = parseFieldChain(FieldChainRequirements.ENDS_IN_ATTRIBUTE, null);
        Class<?> targetType = target.getTargetAttribute().getPropertyType();
        eatSingleCharacterToken(TokenKind.COMMA);

        List<LiteralConstantExpression> constants = new ArrayList<>();
        constants.add(convert(parseConstant(), targetType));
        while (peekKind(TokenKind.COMMA)) {
            eatSingleCharacterToken(TokenKind.COMMA);
            constants.add(convert(parseConstant(), targetType));
        }

        eatSingleCharacterToken(TokenKind.CLOSE_PARENTHESIS);
        return new AnyExpression(target, constants);
    }

    private CollectionNotEmptyExpression parseHas() {
        eatText("has");
        eatSingleCharacterToken(TokenKind.OPEN_PARENTHESIS);
        ResourceFieldChainExpression target = parseFieldChain(FieldChainRequirements.ENDS_IN_TO_MANY, null);
        eatSingleCharacterToken(TokenKind.CLOSE_PARENTHESIS);
        return new CollectionNotEmptyExpression(target);
    }

    private CountExpression parseCount() {
        eatText("count");
        eatSingleCharacterToken(TokenKind.OPEN_PARENTHESIS);
        ResourceFieldChainExpression target = parseFieldChain(FieldChainRequirements.ENDS_IN_TO_MANY, null);
        eatSingleCharacterToken(TokenKind.CLOSE_PARENTHESIS);
        return new CountExpression(target);
    }

    private QueryExpression parseCountOrField(FieldChainRequirements requirements) {
        if (peekText("count")) {
            return parseCount();
        }
        return parseFieldChain(requirements, "Count function or field name expected.");
    }

    private QueryExpression parseCountOrConstantOrNullOrField() {
        if (peekText("count")) {
            return parseCount();
        }
        if (peekKind(TokenKind.QUOTED_TEXT)) {
            return parseConstant();
        }
        if (peekText("null")) {
            tokenStack.pop();
            return NullConstantExpression.INSTANCE;
        }
        return parseFieldChain(
                FieldChainRequirements.ENDS_IN_ATTRIBUTE,
                "Count function, value between quotes, null or field name expected.");
    }

    private LiteralConstantExpression parseConstant() {
        Token token = tokenStack.poll();
        if (token != null && token.kind() == TokenKind.QUOTED_TEXT) {
            return new LiteralConstantExpression(token.value());
        }
        throw new QueryParseException("Value between quotes expected.");
    }

    private QueryExpression convertRightOperand(QueryExpression left, QueryExpression right) {
        if (!(right instanceof LiteralConstantExpression literal)) {
            return right;
        }
        if (left instanceof CountExpression) {
            return convert(literal, Integer.class);
        }
        ResourceFieldChainExpression leftChain = (ResourceFieldChainExpression) left;
        return convert(literal, leftChain.getLastField().getPropertyType());
    }

    private static LiteralConstantExpression convert(LiteralConstantExpression literal, Class<?> targetType) {
        try {
            return new LiteralConstantExpression(
                    RuntimeTypeConverter.convertType(literal.text(), targetType), literal.text());
        } catch (IllegalArgumentException e) {
            throw new QueryParseException(e.getMessage(), e);
        }
    }

    @Override
    protected List<ResourceFieldAttribute> onResolveFieldChain(String path, FieldChainRequirements requirements) {
        return switch (requirements) {
            case ENDS_IN_TO_MANY -> chainResolver.resolveToOneChainEndingInToMany(resourceContextInScope, path);
            case ENDS_IN_ATTRIBUTE -> chainResolver.resolveToOneChainEndingInAttribute(
                    resourceContextInScope, path, AttrCapabilities.ALLOW_FILTER);
            case ENDS_IN_ATTRIBUTE_OR_TO_ONE -> chainResolver.resolveToOneChainEndingInAttributeOrToOne(
                    resourceContextInScope, path, AttrCapabilities.ALLOW_FILTER);
            default -> throw new IllegalStateException("Unexpected chain requirement " + requirements);
        };
    }
}
