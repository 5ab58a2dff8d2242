package com.flow.canvas.service.engine;

import com.flow.canvas.service.api.dto.FlowGraphRequest;
import com.flow.canvas.service.api.dto.FlowGraphRequest.EdgeDto;
import com.flow.canvas.service.api.dto.FlowGraphRequest.NodeDto;
import com.flow.canvas.service.graph.EdgeKind;
import com.flow.canvas.service.graph.FlowGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds a {@link FlowGraph} from an inbound graph request.
 *
 * Nodes are registered in list order, edges declared in list order. When the
 * request names no entry node, the first listed node becomes the entry.
 */
@Slf4j
@Component
public class FlowGraphAssembler {

    // ==================== Public API ====================

    /**
     * Assembles a fresh graph for one build pass.
     *
     * @throws com.flow.canvas.service.graph.UnknownNodeException if an edge or the entry references an unknown node
     * @throws IllegalArgumentException if an edge kind is missing its key
     */
    public FlowGraph assemble(FlowGraphRequest request) {
        log.debug("Assembling graph: {}", request.getGraphId());

        var graph = new FlowGraph();
        registerNodes(graph, nullSafe(request.getNodes()));
        declareEdges(graph, nullSafe(request.getEdges()));
        assignEntry(graph, request);

        log.debug("Assembled graph {} with {} nodes and {} edges",
                request.getGraphId(), graph.nodeCount(), graph.edgeCount());
        return graph;
    }

    // ==================== Assembly Steps ====================

    private void registerNodes(FlowGraph graph, List<NodeDto> nodes) {
        nodes.forEach(node -> graph.addNode(node.getNodeId(), node.getCategory()));
    }

    private void declareEdges(FlowGraph graph, List<EdgeDto> edges) {
        edges.forEach(edge -> graph.addEdge(
                edge.getSourceNodeId(),
                edge.getTargetNodeId(),
                EdgeKind.of(edge.getKind(), edge.getKey())));
    }

    private void assignEntry(FlowGraph graph, FlowGraphRequest request) {
        var entryId = resolveEntryId(request);
        if (entryId == null) {
            log.debug("Graph {} has no nodes, leaving entry unset", request.getGraphId());
            return;
        }
        graph.setEntry(entryId);
    }

    // ==================== Utility Methods ====================

    private String resolveEntryId(FlowGraphRequest request) {
        if (request.getEntryNodeId() != null && !request.getEntryNodeId().isBlank()) {
            return request.getEntryNodeId();
        }
        var nodes = nullSafe(request.getNodes());
        return nodes.isEmpty() ? null : nodes.get(0).getNodeId();
    }

    private <T> List<T> nullSafe(List<T> list) {
        return list != null ? list : List.of();
    }
}
