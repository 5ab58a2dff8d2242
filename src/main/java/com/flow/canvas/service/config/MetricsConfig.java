package com.flow.canvas.service.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics configuration for Flow Canvas Service.
 *
 * Provides custom metrics for layout, validation and compile operations.
 */
@Configuration
@Getter
public class MetricsConfig {

    private final MeterRegistry registry;

    // Counters
    private final Counter layoutsCompleted;
    private final Counter validationsCompleted;
    private final Counter validationsFailed;
    private final Counter compilesCompleted;

    // Timers
    private final Timer layoutTimer;
    private final Timer validationTimer;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;

        // Initialize counters
        this.layoutsCompleted = Counter.builder("flow.layout.count")
                .description("Number of layout passes completed")
                .register(registry);

        this.validationsCompleted = Counter.builder("flow.validation.count")
                .description("Number of structural analysis passes completed")
                .register(registry);

        this.validationsFailed = Counter.builder("flow.validation.failed.count")
                .description("Number of analysis passes that reported issues")
                .register(registry);

        this.compilesCompleted = Counter.builder("flow.compile.count")
                .description("Number of flows compiled")
                .register(registry);

        // Initialize timers
        this.layoutTimer = Timer.builder("flow.layout.duration")
                .description("Time taken for layout passes")
                .register(registry);

        this.validationTimer = Timer.builder("flow.validation.duration")
                .description("Time taken for structural analysis")
                .register(registry);
    }
}
