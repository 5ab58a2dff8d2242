package com.flow.canvas.service.config;

import com.flow.canvas.service.validation.FlowValidator;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Overall application configuration for Flow Canvas Service.
 *
 * Contains feature toggles and validation rule settings.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "flow")
public class FlowConfig {

    /**
     * Feature flags for optional behavior.
     */
    private Features features = new Features();

    /**
     * Structural validation settings.
     */
    private Validation validation = new Validation();

    @Getter
    @Setter
    public static class Features {

        /**
         * Fail compilation when validation reports any issue.
         * When disabled, compile still lays out the flow and returns the issues.
         */
        private boolean strictCompile = true;
    }

    @Getter
    @Setter
    public static class Validation {

        /**
         * Error types every input-collecting node must handle.
         */
        private List<String> mandatoryErrorHandlers =
                new ArrayList<>(FlowValidator.DEFAULT_MANDATORY_ERROR_HANDLERS);
    }
}
