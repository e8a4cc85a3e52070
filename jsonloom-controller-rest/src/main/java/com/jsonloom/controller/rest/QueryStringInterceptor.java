package com.jsonloom.controller.rest;

import com.jsonloom.service.core.queries.QuerySpecification;
import com.jsonloom.service.core.querystrings.DisableQueryString;
import com.jsonloom.service.core.querystrings.QueryStringReaderFactory;
import com.jsonloom.service.core.querystrings.StandardQueryStringParameter;
import com.jsonloom.service.core.request.JsonApiRequest;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

/**
 * Reads the query string of requests routed to a {@link JsonApiEndpoint} and exposes the result as
 * the {@link #QUERY_SPECIFICATION_ATTRIBUTE} request attribute. Parameters listed in
 * {@link DisableQueryString} on the handler method or its class are rejected.
 */
@Slf4j
public class QueryStringInterceptor implements HandlerInterceptor {

    public static final String QUERY_SPECIFICATION_ATTRIBUTE =
            "com.jsonloom.controller.rest.QueryStringInterceptor" + ".QUERY_SPECIFICATION";

    private final QueryStringReaderFactory readerFactory;

    public QueryStringInterceptor(QueryStringReaderFactory readerFactory) {
        this.readerFactory = readerFactory;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod method) || !(method.getBean() instanceof JsonApiEndpoint endpoint)) {
            return true;
        }

        @SuppressWarnings("unchecked")
        Map<String, String> pathVariables =
                (Map<String, String>) request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        JsonApiRequest jsonApiRequest = endpoint.resolveRequest(pathVariables == null ? Map.of() : pathVariables);

        QuerySpecification query = readerFactory
                .create(jsonApiRequest, new ServletRequestQueryStringAccessor(request))
                .readAll(disabledParameters(method));
        log.debug("Read query string of {} {}: {}", request.getMethod(), request.getRequestURI(), query);
        request.setAttribute(QUERY_SPECIFICATION_ATTRIBUTE, query);
        return true;
    }

    static Set<StandardQueryStringParameter> disabledParameters(HandlerMethod method) {
        DisableQueryString annotation =
                AnnotatedElementUtils.findMergedAnnotation(method.getMethod(), DisableQueryString.class);
        if (annotation == null) {
            annotation = AnnotatedElementUtils.findMergedAnnotation(method.getBeanType(), DisableQueryString.class);
        }
        if (annotation == null || annotation.value().length == 0) {
            return Set.of();
        }
        return EnumSet.of(annotation.value()[0], annotation.value());
    }
}
