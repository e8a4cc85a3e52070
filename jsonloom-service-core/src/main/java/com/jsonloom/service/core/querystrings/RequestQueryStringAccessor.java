package com.jsonloom.service.core.querystrings;

import java.util.List;
import java.util.Map;

/** Supplies the raw query string of the current request, in the order parameters appeared. */
public interface RequestQueryStringAccessor {

    Map<String, List<String>> getQuery();
}
