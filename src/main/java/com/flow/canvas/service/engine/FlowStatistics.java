package com.flow.canvas.service.engine;

import com.flow.canvas.service.graph.NodeCategory;
import com.flow.canvas.service.layout.CanvasDimensions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Summary figures for one flow graph.
 */
public record FlowStatistics(
        int totalNodes,
        int totalEdges,
        Map<NodeCategory, Long> nodesByCategory,
        int nodesRequiringHandlers,
        int nodesWithHandlers,
        double coveragePercent,
        CanvasDimensions canvas,
        ValidationStatus validationStatus
) {

    public enum ValidationStatus {
        PASSED,
        FAILED
    }

    public FlowStatistics {
        nodesByCategory = Collections.unmodifiableMap(new LinkedHashMap<>(nodesByCategory));
    }
}
