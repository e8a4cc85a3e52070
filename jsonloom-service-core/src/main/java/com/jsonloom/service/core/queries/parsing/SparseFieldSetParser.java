package com.jsonloom.service.core.queries.parsing;

import com.jsonloom.core.resources.ResourceContext;
import com.jsonloom.core.resources.ResourceFieldAttribute;
import com.jsonloom.service.core.queries.expressions.ResourceFieldChainExpression;
import com.jsonloom.service.core.queries.expressions.SparseFieldSetExpression;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Parses the comma-separated field names of a {@code fields[type]} parameter. */
public class SparseFieldSetParser extends QueryExpressionParser {
    private ResourceContext resourceContext;

    public SparseFieldSetParser(ResourceFieldChainResolver chainResolver) {
        super(chainResolver);
    }

    public SparseFieldSetExpression parse(String source, ResourceContext resourceContext) {
        this.resourceContext = resourceContext;
        tokenize(source);

        Set<ResourceFieldAttribute> fields = new LinkedHashSet<>();
        while (!tokenStack.isEmpty()) {
            if (!fields.isEmpty()) {
                eatSingleCharacterToken(TokenKind.COMMA);
            }
            ResourceFieldChainExpression next = parseFieldChain(FieldChainRequirements.ENDS_IN_ATTRIBUTE, "Field name expected.");
            fields.add(next.getLastField());
        }
        if (fields.isEmpty()) {
            throw new QueryParseException("Field name expected.");
        }
        return new SparseFieldSetExpression(fields);
    }

    @Override
    protected List<ResourceFieldAttribute> onResolveFieldChain(String path, FieldChainRequirements requirements) {
        return List.of(chainResolver.resolveSparseField(resourceContext, path));
    }
}
