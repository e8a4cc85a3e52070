package com.jsonloom.service.core.fixtures;

import com.jsonloom.core.configuration.JsonApiOptions;
import com.jsonloom.core.resources.ResourceGraph;
import com.jsonloom.core.resources.ResourceGraphBuilder;
import com.jsonloom.service.core.querystrings.RequestQueryStringAccessor;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Shared resource graph and helpers for tests across modules. */
public final class Fixtures {

    private Fixtures() {}

    public static ResourceGraph graph() {
        return new ResourceGraphBuilder()
                .add(WorkItem.class)
                .add(UserAccount.class)
                .add(WorkTag.class)
                .add(Article.class)
                .add(Tag.class)
                .add(IdentifiableArticleTag.class)
                .build();
    }

    public static JsonApiOptions options() {
        return new JsonApiOptions();
    }

    /** Builds an accessor from alternating parameter names and values. */
    public static RequestQueryStringAccessor query(String... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected name/value pairs");
        }
        Map<String, List<String>> query = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            query.computeIfAbsent(namesAndValues[i], key -> new ArrayList<>()).add(namesAndValues[i + 1]);
        }
        return () -> query;
    }
}
