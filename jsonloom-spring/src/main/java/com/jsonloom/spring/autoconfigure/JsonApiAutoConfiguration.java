package com.jsonloom.spring.autoconfigure;

import com.jsonloom.core.configuration.JsonApiOptions;
import com.jsonloom.core.resources.ResourceGraph;
import com.jsonloom.core.resources.ResourceGraphBuilder;
import com.jsonloom.service.core.atomic.DefaultOperationsProcessor;
import com.jsonloom.service.core.atomic.MissingTransactionFactory;
import com.jsonloom.service.core.atomic.OperationProcessorAccessor;
import com.jsonloom.service.core.atomic.OperationsProcessor;
import com.jsonloom.service.core.atomic.OperationsTransactionFactory;
import com.jsonloom.service.core.hooks.DefaultResourceHookExecutor;
import com.jsonloom.service.core.hooks.NoResourceHookExecutor;
import com.jsonloom.service.core.hooks.ResourceHookExecutor;
import com.jsonloom.service.core.hooks.ResourceHooksDefinition;
import com.jsonloom.service.core.hooks.ResourceHooksRegistry;
import com.jsonloom.service.core.querystrings.QueryStringReaderFactory;
import com.jsonloom.service.core.services.ResourceService;
import com.jsonloom.service.core.services.ResourceServiceRegistry;
import com.jsonloom.spring.transaction.SpringOperationsTransactionFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.transaction.TransactionAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.transaction.PlatformTransactionManager;

/**
 * Core jsonloom beans: options bound from {@code jsonloom.*}, the resource graph built from
 * {@link ResourceGraphContributor} beans, the service and hook registries filled from the
 * application's {@link ResourceService} and {@link ResourceHooksDefinition} beans, and the atomic
 * operations pipeline.
 *
 * <h3>Configuration Example:</h3>
 * <pre>{@code
 * # application.yml
 * jsonloom:
 *   enable-resource-hooks: true
 *   default-page-size: 25
 *   maximum-operations-per-request: 20
 * }</pre>
 */
@Slf4j
@AutoConfiguration(after = TransactionAutoConfiguration.class)
@EnableConfigurationProperties
public class JsonApiAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    @ConfigurationProperties(prefix = "jsonloom")
    public JsonApiOptions jsonApiOptions() {
        return new JsonApiOptions();
    }

    @Bean
    @ConditionalOnMissingBean
    public ResourceGraph resourceGraph(ObjectProvider<ResourceGraphContributor> contributors) {
        ResourceGraphBuilder builder = new ResourceGraphBuilder();
        contributors.orderedStream().forEach(contributor -> contributor.contribute(builder));
        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean
    public ResourceServiceRegistry resourceServiceRegistry(ObjectProvider<ResourceService<?, ?>> services) {
        ResourceServiceRegistry registry = new ResourceServiceRegistry();
        services.orderedStream().forEach(registry::register);
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public ResourceHooksRegistry resourceHooksRegistry(ObjectProvider<ResourceHooksDefinition<?>> definitions) {
        ResourceHooksRegistry registry = new ResourceHooksRegistry();
        definitions.orderedStream().forEach(registry::register);
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public ResourceHookExecutor resourceHookExecutor(
            JsonApiOptions options, ResourceHooksRegistry hooksRegistry, ResourceGraph resourceGraph) {
        if (!options.isEnableResourceHooks()) {
            if (!hooksRegistry.getDefinitions().isEmpty()) {
                log.warn(
                        "{} resource hook definitions are registered but 'jsonloom.enable-resource-hooks' is false; "
                                + "they will not be invoked",
                        hooksRegistry.getDefinitions().size());
            }
            return NoResourceHookExecutor.INSTANCE;
        }
        return new DefaultResourceHookExecutor(hooksRegistry, resourceGraph);
    }

    @Bean
    @ConditionalOnMissingBean
    public QueryStringReaderFactory queryStringReaderFactory(ResourceGraph resourceGraph, JsonApiOptions options) {
        return new QueryStringReaderFactory(resourceGraph, options);
    }

    @Bean
    @ConditionalOnMissingBean
    public OperationProcessorAccessor operationProcessorAccessor(ResourceServiceRegistry serviceRegistry) {
        return new OperationProcessorAccessor(serviceRegistry);
    }

    @Bean
    @ConditionalOnMissingBean(OperationsTransactionFactory.class)
    @ConditionalOnBean(PlatformTransactionManager.class)
    public OperationsTransactionFactory springOperationsTransactionFactory(
            PlatformTransactionManager transactionManager) {
        return new SpringOperationsTransactionFactory(transactionManager);
    }

    @Bean
    @ConditionalOnMissingBean(OperationsTransactionFactory.class)
    public OperationsTransactionFactory missingTransactionFactory() {
        return new MissingTransactionFactory();
    }

    @Bean
    @ConditionalOnMissingBean
    public OperationsProcessor operationsProcessor(
            OperationProcessorAccessor processorAccessor,
            OperationsTransactionFactory transactionFactory,
            ResourceGraph resourceGraph,
            JsonApiOptions options) {
        return new DefaultOperationsProcessor(processorAccessor, transactionFactory, resourceGraph, options);
    }
}
