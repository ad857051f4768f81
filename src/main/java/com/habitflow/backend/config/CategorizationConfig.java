package com.habitflow.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.habitflow.backend.categorization.registry.CategoryRegistry;
import com.habitflow.backend.categorization.registry.CategoryRegistryLoader;

/**
 * Loads the category registry once at startup. A missing or invalid asset aborts the context.
 */
@Configuration
public class CategorizationConfig {

    @Bean
    public CategoryRegistryLoader categoryRegistryLoader(ObjectMapper objectMapper) {
        return new CategoryRegistryLoader(objectMapper);
    }

    @Bean
    public CategoryRegistry categoryRegistry(CategoryRegistryLoader loader,
                                             CategorizationProperties properties,
                                             ResourceLoader resourceLoader) {
        return loader.load(resourceLoader.getResource(properties.registryLocation()));
    }
}
