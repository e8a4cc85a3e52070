package com.jsonloom.service.core.querystrings;

import com.jsonloom.core.configuration.JsonApiOptions;
import com.jsonloom.core.resources.ResourceGraph;
import com.jsonloom.service.core.request.JsonApiRequest;
import java.util.List;

/** Creates the per-request reader set. The factory itself is stateless and shared. */
public class QueryStringReaderFactory {
    private final ResourceGraph resourceGraph;
    private final JsonApiOptions options;

    public QueryStringReaderFactory(ResourceGraph resourceGraph, JsonApiOptions options) {
        this.resourceGraph = resourceGraph;
        this.options = options;
    }

    public QueryStringReader create(JsonApiRequest request, RequestQueryStringAccessor queryStringAccessor) {
        List<QueryStringParameterReader> readers = List.of(
                new IncludeQueryStringParameterReader(request, resourceGraph, options),
                new FilterQueryStringParameterReader(request, resourceGraph, options),
                new SortQueryStringParameterReader(request, resourceGraph, options),
                new SparseFieldSetQueryStringParameterReader(request, resourceGraph, options),
                new PaginationQueryStringParameterReader(request, resourceGraph, options),
                new DefaultsQueryStringParameterReader(request, resourceGraph, options),
                new NullsQueryStringParameterReader(request, resourceGraph, options));
        return new QueryStringReader(options, queryStringAccessor, readers);
    }

    public JsonApiOptions getOptions() {
        return options;
    }
}
