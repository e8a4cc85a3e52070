package com.jsonloom.service.core.queries.parsing;

import com.jsonloom.core.resources.RelationshipAttribute;
import com.jsonloom.core.resources.ResourceContext;
import com.jsonloom.core.resources.ResourceFieldAttribute;
import com.jsonloom.service.core.queries.expressions.IncludeExpression;
import com.jsonloom.service.core.queries.expressions.ResourceFieldChainExpression;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/** Parses {@code author,comments.author} into an include tree. */
public class IncludeParser extends QueryExpressionParser {
    private ResourceContext resourceContextInScope;

    public IncludeParser(ResourceFieldChainResolver chainResolver) {
        super(chainResolver);
    }

    public IncludeExpression parse(String source, ResourceContext resourceContextInScope, Integer maximumDepth) {
        this.resourceContextInScope = resourceContextInScope;
        tokenize(source);
        List<List<RelationshipAttribute>> chains = parseChains();
        assertTokenStackIsEmpty();
        validateMaximumIncludeDepth(maximumDepth, chains);
        return IncludeExpression.fromChains(chains);
    }

    private List<List<RelationshipAttribute>> parseChains() {
        List<List<RelationshipAttribute>> chains = new ArrayList<>();
        chains.add(toRelationships(parseFieldChain(FieldChainRequirements.IS_RELATIONSHIP, "Relationship name expected.")));
        while (peekKind(TokenKind.COMMA)) {
            eatSingleCharacterToken(TokenKind.COMMA);
            chains.add(toRelationships(
                    parseFieldChain(FieldChainRequirements.IS_RELATIONSHIP, "Relationship name expected.")));
        }
        return chains;
    }

    private static List<RelationshipAttribute> toRelationships(ResourceFieldChainExpression chain) {
        return chain.fields().stream().map(RelationshipAttribute.class::cast).toList();
    }

    private static void validateMaximumIncludeDepth(Integer maximumDepth, List<List<RelationshipAttribute>> chains) {
        if (maximumDepth == null) {
            return;
        }
        for (List<RelationshipAttribute> chain : chains) {
            if (chain.size() > maximumDepth) {
                String path = chain.stream().map(RelationshipAttribute::getPublicName).collect(Collectors.joining("."));
                throw new QueryParseException(
                        "Including '" + path + "' exceeds the maximum inclusion depth of " + maximumDepth + ".");
            }
        }
    }

    @Override
    protected List<ResourceFieldAttribute> onResolveFieldChain(String path, FieldChainRequirements requirements) {
        return chainResolver.resolveRelationshipChain(resourceContextInScope, path, (relationship, owner) -> {
            if (!relationship.canInclude()) {
                throw new QueryParseException("Including the relationship '" + relationship.getPublicName() + "' on '"
                        + owner.getPublicName() + "' is not allowed.");
            }
        });
    }
}
