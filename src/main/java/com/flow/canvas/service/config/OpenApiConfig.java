package com.flow.canvas.service.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for API documentation.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private int serverPort;

    @Value("${spring.application.name:flow-canvas-service}")
    private String applicationName;

    @Bean
    public OpenAPI flowCanvasServiceOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Flow Canvas Service API")
                        .description("Canvas layout and structural validation for call-flow graphs. " +
                                "Each request carries one complete graph; nothing is stored between requests. " +
                                "Graphs with structural issues are rejected with 422 FLOW_VALIDATION_FAILED.")
                        .version("1.0.0"))
                .tags(List.of(
                        new Tag().name("Flow Canvas")
                                .description("Layout, analysis, validation, compilation and statistics")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description(applicationName + " (local)")
                ));
    }
}
