package com.jsonloom.service.core.queries.parsing;

import com.jsonloom.core.resources.ResourceContext;
import com.jsonloom.core.resources.ResourceFieldAttribute;
import com.jsonloom.service.core.queries.expressions.ResourceFieldChainExpression;
import java.util.List;

/** Parses parameter names such as {@code filter} or {@code sort[articles.comments]}. */
public class QueryStringParameterScopeParser extends QueryExpressionParser {
    private final FieldChainRequirements chainRequirements;
    private ResourceContext resourceContextInScope;

    public QueryStringParameterScopeParser(
            ResourceFieldChainResolver chainResolver, FieldChainRequirements chainRequirements) {
        super(chainResolver);
        this.chainRequirements = chainRequirements;
    }

    public QueryStringParameterScope parse(String source, ResourceContext resourceContextInScope) {
        this.resourceContextInScope = resourceContextInScope;
        tokenize(source);

        Token token = tokenStack.poll();
        if (token == null || token.kind() != TokenKind.TEXT) {
            throw new QueryParseException("Parameter name expected.");
        }

        ResourceFieldChainExpression scope = null;
        if (peekKind(TokenKind.OPEN_BRACKET)) {
            tokenStack.pop();
            scope = parseFieldChain(chainRequirements, null);
            eatSingleCharacterToken(TokenKind.CLOSE_BRACKET);
        }

        assertTokenStackIsEmpty();
        return new QueryStringParameterScope(token.value(), scope);
    }

    @Override
    protected List<ResourceFieldAttribute> onResolveFieldChain(String path, FieldChainRequirements requirements) {
        if (requirements == FieldChainRequirements.ENDS_IN_TO_MANY) {
            return chainResolver.resolveToManyChain(resourceContextInScope, path);
        }
        if (requirements == FieldChainRequirements.IS_RELATIONSHIP) {
            return chainResolver.resolveRelationshipChain(resourceContextInScope, path, null);
        }
        throw new IllegalStateException("Unexpected chain requirement " + requirements);
    }
}
