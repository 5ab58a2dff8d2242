package com.flow.canvas.service.api.dto;

import com.flow.canvas.service.layout.CanvasDimensions;
import com.flow.canvas.service.layout.NodePosition;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * DTO for layout results.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LayoutResponse {

    private String graphId;
    private String entryNodeId;

    /**
     * Grid cell and pixel position per node, in placement order.
     */
    private List<PlacementResponse> placements;

    /**
     * Node id to pixel position.
     */
    private Map<String, NodePosition> positions;

    private CanvasDimensions canvas;
    private int collisionsResolved;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PlacementResponse {
        private String nodeId;
        private int level;
        private int row;
        private int x;
        private int y;
    }
}
