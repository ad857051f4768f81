package com.habitflow.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.habitflow.backend.categorization.registry.CategoryRegistry;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI habitFlowOpenAPI(CategoryRegistry registry) {
        return new OpenAPI()
                .info(new Info()
                        .title("HabitFlow Categorization API")
                        .description("Offline, rule-based category suggestions for habit names (registry "
                                + registry.version() + ").")
                        .version("v1")
                );
    }
}
