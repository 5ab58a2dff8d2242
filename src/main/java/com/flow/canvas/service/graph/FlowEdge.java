package com.flow.canvas.service.graph;

/**
 * Directed, typed transition between two registered nodes.
 *
 * @param sourceId source node identifier
 * @param targetId target node identifier
 * @param kind     semantic kind of the transition
 * @param sequence declaration sequence number, assigned by the graph when the edge is added
 */
public record FlowEdge(
        String sourceId,
        String targetId,
        EdgeKind kind,
        long sequence
) {}
