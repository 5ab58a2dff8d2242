package com.flow.canvas.service.api.dto;

import com.flow.canvas.service.layout.CanvasDimensions;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * DTO for flow statistics.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FlowStatsResponse {

    private String graphId;
    private int totalNodes;
    private int totalEdges;
    private Map<String, Long> nodesByCategory;
    private ErrorHandlerCoverage errorHandlerCoverage;
    private CanvasDimensions canvas;
    private String validationStatus;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ErrorHandlerCoverage {
        private int nodesWithHandlers;
        private int nodesRequiringHandlers;
        private double coveragePercent;
    }
}
