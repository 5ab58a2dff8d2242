package com.flow.canvas.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Flow Canvas Service Application - Entry point for the Spring Boot application.
 *
 * This application prepares call-flow graphs for a visual designer. It:
 * - Lays out nodes on a left-to-right canvas grid
 * - Checks flows for orphaned nodes, dead ends and missing error handlers
 * - Compiles validated flows with their presentation positions
 */
@SpringBootApplication
@ConfigurationPropertiesScan("com.flow.canvas.service.config")
public class FlowCanvasServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlowCanvasServiceApplication.class, args);
    }
}
