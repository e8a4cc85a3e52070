package com.jsonloom.controller.rest;

import com.jsonloom.service.core.querystrings.RequestQueryStringAccessor;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Exposes the decoded query string parameters of a servlet request. */
public class ServletRequestQueryStringAccessor implements RequestQueryStringAccessor {
    private final HttpServletRequest request;

    public ServletRequestQueryStringAccessor(HttpServletRequest request) {
        this.request = request;
    }

    @Override
    public Map<String, List<String>> getQuery() {
        Map<String, List<String>> query = new LinkedHashMap<>();
        request.getParameterMap().forEach((name, values) -> query.put(name, Arrays.asList(values)));
        return query;
    }
}
