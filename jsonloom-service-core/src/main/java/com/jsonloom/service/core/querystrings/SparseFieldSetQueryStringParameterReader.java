package com.jsonloom.service.core.querystrings;

import com.jsonloom.core.configuration.JsonApiOptions;
import com.jsonloom.core.errors.InvalidQueryStringParameterException;
import com.jsonloom.core.resources.ResourceContext;
import com.jsonloom.core.resources.ResourceFieldAttribute;
import com.jsonloom.core.resources.ResourceGraph;
import com.jsonloom.service.core.queries.expressions.ExpressionInScope;
import com.jsonloom.service.core.queries.expressions.SparseFieldSetExpression;
import com.jsonloom.service.core.queries.expressions.SparseFieldTableExpression;
import com.jsonloom.service.core.queries.parsing.QueryParseException;
import com.jsonloom.service.core.queries.parsing.ResourceFieldChainResolver;
import com.jsonloom.service.core.queries.parsing.SparseFieldSetParser;
import com.jsonloom.service.core.request.JsonApiRequest;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Reads {@code fields[type]=a,b}. Repeating a type adds to its fieldset. */
public class SparseFieldSetQueryStringParameterReader extends AbstractQueryStringParameterReader
        implements QueryConstraintProvider {
    private static final String PREFIX = "fields[";

    private final SparseFieldSetParser fieldSetParser = new SparseFieldSetParser(new ResourceFieldChainResolver());
    private final Map<ResourceContext, SparseFieldSetExpression> sparseFieldTable = new LinkedHashMap<>();

    public SparseFieldSetQueryStringParameterReader(
            JsonApiRequest request, ResourceGraph resourceGraph, JsonApiOptions options) {
        super(request, resourceGraph, options);
    }

    @Override
    public boolean isEnabled(Set<StandardQueryStringParameter> disabledParameters) {
        return !StandardQueryStringParameter.isDisabled(disabledParameters, StandardQueryStringParameter.FIELDS);
    }

    @Override
    public boolean canRead(String parameterName) {
        return parameterName.startsWith(PREFIX) && parameterName.endsWith("]");
    }

    @Override
    public void read(String parameterName, String parameterValue) {
        try {
            ResourceContext resourceContext = parseResourceType(parameterName);
            SparseFieldSetExpression fieldSet = fieldSetParser.parse(parameterValue, resourceContext);

            Set<ResourceFieldAttribute> merged = new LinkedHashSet<>();
            SparseFieldSetExpression existing = sparseFieldTable.get(resourceContext);
            if (existing != null) {
                merged.addAll(existing.fields());
            }
            merged.addAll(fieldSet.fields());
            sparseFieldTable.put(resourceContext, new SparseFieldSetExpression(merged));
        } catch (QueryParseException e) {
            throw new InvalidQueryStringParameterException(
                    parameterName, "The specified fieldset is invalid.", e.getMessage(), e);
        }
    }

    private ResourceContext parseResourceType(String parameterName) {
        String typeName = parameterName.substring(PREFIX.length(), parameterName.length() - 1);
        if (typeName.isEmpty()) {
            throw new QueryParseException("Resource type expected.");
        }
        return resourceGraph
                .findResourceContext(typeName)
                .orElseThrow(() -> new QueryParseException("Resource type '" + typeName + "' does not exist."));
    }

    @Override
    public List<ExpressionInScope> getConstraints() {
        return sparseFieldTable.isEmpty()
                ? List.of()
                : List.of(new ExpressionInScope(null, new SparseFieldTableExpression(sparseFieldTable)));
    }

    @Override
    public void reset() {
        sparseFieldTable.clear();
    }
}
