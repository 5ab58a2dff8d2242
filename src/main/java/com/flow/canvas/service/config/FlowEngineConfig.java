package com.flow.canvas.service.config;

import com.flow.canvas.service.layout.CanvasLayoutEngine;
import com.flow.canvas.service.validation.FlowValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the flow graph engine beans.
 *
 * Layout and validation are plain, framework-free classes; this
 * configuration creates them from the bound properties.
 */
@Slf4j
@Configuration
public class FlowEngineConfig {

    /**
     * Canvas layout engine.
     * Layered BFS positioning with row compaction and collision resolution.
     */
    @Bean
    public CanvasLayoutEngine canvasLayoutEngine(LayoutConfig layoutConfig) {
        var settings = layoutConfig.toSettings();
        log.info("Initializing CanvasLayoutEngine (compaction={}, vertical spacing={}px)",
                settings.rowCompaction(), settings.verticalSpacing());
        return new CanvasLayoutEngine(settings);
    }

    /**
     * Structural flow validator.
     * Orphans, unterminated paths and mandatory error handlers.
     */
    @Bean
    public FlowValidator flowValidator(FlowConfig flowConfig) {
        var mandatory = flowConfig.getValidation().getMandatoryErrorHandlers();
        log.info("Initializing FlowValidator (mandatory error handlers: {})", mandatory);
        return new FlowValidator(mandatory);
    }
}
