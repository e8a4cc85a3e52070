package com.jsonloom.service.core.queries.parsing;

import com.jsonloom.core.resources.ResourceFieldAttribute;
import com.jsonloom.service.core.queries.expressions.ResourceFieldChainExpression;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Recursive-descent parser base. Subclasses decide how field chains resolve. Instances keep the
 * token stack of the current parse and are not thread-safe.
 */
public abstract class QueryExpressionParser {
    protected final ResourceFieldChainResolver chainResolver;
    protected Deque<Token> tokenStack = new ArrayDeque<>();

    protected QueryExpressionParser(ResourceFieldChainResolver chainResolver) {
        this.chainResolver = chainResolver;
    }

    protected abstract List<ResourceFieldAttribute> onResolveFieldChain(String path, FieldChainRequirements requirements);

    protected void tokenize(String source) {
        tokenStack = new ArrayDeque<>(new QueryTokenizer(source).tokenize());
    }

    protected ResourceFieldChainExpression parseFieldChain(
            FieldChainRequirements requirements, String alternativeErrorMessage) {
        Token token = tokenStack.poll();
        if (token != null && token.kind() == TokenKind.TEXT) {
            List<ResourceFieldAttribute> chain = onResolveFieldChain(token.value(), requirements);
            if (!chain.isEmpty()) {
                return new ResourceFieldChainExpression(chain);
            }
        }
        throw new QueryParseException(alternativeErrorMessage != null ? alternativeErrorMessage : "Field name expected.");
    }

    protected boolean peekText(String text) {
        Token next = tokenStack.peek();
        return next != null && next.kind() == TokenKind.TEXT && text.equals(next.value());
    }

    protected boolean peekKind(TokenKind kind) {
        Token next = tokenStack.peek();
        return next != null && next.kind() == kind;
    }

    protected void eatText(String text) {
        Token token = tokenStack.poll();
        if (token == null || token.kind() != TokenKind.TEXT || !text.equals(token.value())) {
            throw new QueryParseException(text + " expected.");
        }
    }

    protected void eatSingleCharacterToken(TokenKind kind) {
        Token token = tokenStack.poll();
        if (token == null || token.kind() != kind) {
            throw new QueryParseException(kind.symbol() + " expected.");
        }
    }

    protected void assertTokenStackIsEmpty() {
        if (!tokenStack.isEmpty()) {
            throw new QueryParseException("End of expression expected.");
        }
    }
}
