package com.flow.canvas.service.api.dto;

import com.flow.canvas.service.graph.EdgeKind;
import com.flow.canvas.service.graph.NodeCategory;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * DTO describing one complete flow graph.
 *
 * Edge list order is the declaration order used for layout.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FlowGraphRequest {

    /**
     * Caller-chosen identifier echoed in responses.
     */
    @NotBlank(message = "graphId is required")
    private String graphId;

    /**
     * Entry node. When absent, the first listed node becomes the entry.
     */
    private String entryNodeId;

    /**
     * Nodes in registration order.
     */
    @Valid
    @NotNull(message = "nodes are required")
    private List<@NotNull(message = "node entries must not be null") NodeDto> nodes;

    /**
     * Edges in declaration order.
     */
    @Valid
    @NotNull(message = "edges are required")
    private List<@NotNull(message = "edge entries must not be null") EdgeDto> edges;

    /**
     * Caller metadata, accepted but not interpreted.
     */
    private Map<String, Object> metadata;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class NodeDto {

        @NotBlank(message = "nodeId is required")
        private String nodeId;

        @NotNull(message = "category is required")
        private NodeCategory category;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EdgeDto {

        @NotBlank(message = "sourceNodeId is required")
        private String sourceNodeId;

        @NotBlank(message = "targetNodeId is required")
        private String targetNodeId;

        @NotNull(message = "kind is required")
        private EdgeKind.Type kind;

        /**
         * Comparison value, error type or intent name for keyed kinds.
         */
        private String key;
    }
}
