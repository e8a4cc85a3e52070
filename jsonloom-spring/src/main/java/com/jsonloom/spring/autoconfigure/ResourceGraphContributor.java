package com.jsonloom.spring.autoconfigure;

import com.jsonloom.core.resources.ResourceGraphBuilder;

/**
 * Registers resource classes with the application's resource graph. Every contributor bean is
 * applied before the graph is built.
 *
 * <pre>{@code
 * @Bean
 * ResourceGraphContributor workItemResources() {
 *     return builder -> builder.add(WorkItem.class).add(UserAccount.class);
 * }
 * }</pre>
 */
@FunctionalInterface
public interface ResourceGraphContributor {

    void contribute(ResourceGraphBuilder builder);
}
