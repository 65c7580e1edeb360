package com.demo.fit.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {
    @Bean
    public OpenAPI fitEngineOpenAPI() {
        return new OpenAPI().info(new Info()
                .title("University Fit Engine API")
                .description("Fit computation, fit matrix queries, staleness and credits")
                .version("v1"));
    }
}
