package com.z254.sipo.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI documentation configuration for the SIPO service.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:5001}")
    private int serverPort;

    @Bean
    public OpenAPI sipoOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("SIPO Incident Prioritizer API")
                        .description("""
                                SIPO reduces telecom network alert noise for NOC operators.

                                ## Features

                                - **Alert Ingestion**: CSV upload, stored alert data, synthetic Prometheus-style alerts
                                - **Correlation**: Alerts grouped into incidents with impact totals
                                - **Prioritization**: High / Medium / Low by revenue at risk, ranked highest first
                                - **Summary**: Incident totals and alert reduction rate
                                """)
                        .version("1.0.0")
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")
                ))
                .tags(List.of(
                        new Tag()
                                .name("Alerts")
                                .description("Alert ingestion and synthetic generation"),
                        new Tag()
                                .name("Incidents")
                                .description("Correlated, prioritized incidents")
                ));
    }
}
