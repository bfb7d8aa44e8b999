package com.z254.sentinel.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI documentation configuration for SENTINEL service.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8095}")
    private int serverPort;

    @Bean
    public OpenAPI sentinelOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("SENTINEL Anomaly Detection Service API")
                        .description("""
                                SENTINEL watches operational metrics and reports problems early.
                                
                                ## Features
                                
                                - **Anomaly Detection**: Statistical outliers, seasonal deviations and trend changes
                                - **Early Warnings**: Projected threshold, capacity and budget breaches
                                - **Detection Rules**: Rule metadata with trigger and false positive statistics
                                
                                ## Integration
                                
                                SENTINEL reads hourly metric samples from the metric aggregation service.
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")
                ))
                .tags(List.of(
                        new Tag()
                                .name("Anomalies")
                                .description("Anomaly detection and lifecycle"),
                        new Tag()
                                .name("Warnings")
                                .description("Early warnings and lifecycle"),
                        new Tag()
                                .name("Rules")
                                .description("Detection rule management"),
                        new Tag()
                                .name("Summary")
                                .description("Overview of active anomalies and warnings")
                ));
    }
}
