package com.jsonloom.spring.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jsonloom.controller.rest.AtomicOperationsController;
import com.jsonloom.controller.rest.JsonApiExceptionHandler;
import com.jsonloom.controller.rest.QueryStringInterceptor;
import com.jsonloom.controller.rest.ResourceController;
import com.jsonloom.controller.rest.serialization.AtomicOperationsReader;
import com.jsonloom.controller.rest.serialization.ResourceObjectBuilder;
import com.jsonloom.core.configuration.JsonApiOptions;
import com.jsonloom.core.resources.ResourceGraph;
import com.jsonloom.service.core.atomic.OperationsProcessor;
import com.jsonloom.service.core.querystrings.QueryStringReaderFactory;
import com.jsonloom.service.core.services.ResourceServiceRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/** Exposes the JSON:API endpoints in servlet web applications. */
@AutoConfiguration(after = {JsonApiAutoConfiguration.class, JacksonAutoConfiguration.class})
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@ConditionalOnProperty(prefix = "jsonloom.web", name = "enabled", havingValue = "true", matchIfMissing = true)
public class JsonApiWebMvcAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ResourceObjectBuilder resourceObjectBuilder(ResourceGraph resourceGraph) {
        return new ResourceObjectBuilder(resourceGraph);
    }

    @Bean
    @ConditionalOnMissingBean
    public AtomicOperationsReader atomicOperationsReader(ResourceGraph resourceGraph, ObjectMapper objectMapper) {
        return new AtomicOperationsReader(resourceGraph, objectMapper);
    }

    @Bean
    public QueryStringInterceptor queryStringInterceptor(QueryStringReaderFactory readerFactory) {
        return new QueryStringInterceptor(readerFactory);
    }

    @Bean
    public WebMvcConfigurer jsonApiWebMvcConfigurer(QueryStringInterceptor queryStringInterceptor) {
        return new WebMvcConfigurer() {
            @Override
            public void addInterceptors(InterceptorRegistry registry) {
                registry.addInterceptor(queryStringInterceptor);
            }
        };
    }

    @Bean
    public ResourceController resourceController(
            ResourceGraph resourceGraph, ResourceServiceRegistry serviceRegistry, ResourceObjectBuilder objectBuilder) {
        return new ResourceController(resourceGraph, serviceRegistry, objectBuilder);
    }

    @Bean
    public AtomicOperationsController atomicOperationsController(
            OperationsProcessor operationsProcessor,
            AtomicOperationsReader operationsReader,
            ResourceObjectBuilder objectBuilder,
            JsonApiOptions options) {
        return new AtomicOperationsController(operationsProcessor, operationsReader, objectBuilder, options);
    }

    @Bean
    public JsonApiExceptionHandler jsonApiExceptionHandler(JsonApiOptions options) {
        return new JsonApiExceptionHandler(options);
    }
}
