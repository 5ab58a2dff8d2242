package com.flow.canvas.service.graph;

import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory call-flow graph of categorized nodes and typed edges.
 *
 * Built once per compile pass by the assembler, consumed by layout and
 * validation, then discarded. Not thread-safe; a graph is never shared
 * between passes.
 *
 * Ordering never depends on map iteration: nodes carry a registration
 * sequence and edges a declaration sequence, and every query sorts by them.
 */
public class FlowGraph {

    private static final Comparator<FlowEdge> BY_SEQUENCE = Comparator.comparingLong(FlowEdge::sequence);
    private static final Comparator<FlowNode> BY_REGISTRATION = Comparator.comparingLong(FlowNode::sequence);

    private final Map<String, FlowNode> nodes = new HashMap<>();
    private final Map<String, Map<String, FlowEdge>> outgoing = new HashMap<>();

    private long nextNodeSequence;
    private long nextEdgeSequence;
    private String entryId;

    // ==================== Construction ====================

    /**
     * Registers a node. Re-registering an identifier replaces its category
     * but keeps its registration order and outgoing edges.
     *
     * @return the registered node
     */
    public FlowNode addNode(String id, NodeCategory category) {
        requireId(id, "node id");
        if (category == null) {
            throw new IllegalArgumentException("category is required for node " + id);
        }

        var existing = nodes.get(id);
        long sequence = existing != null ? existing.sequence() : nextNodeSequence++;
        var node = new FlowNode(id, category, sequence);

        nodes.put(id, node);
        outgoing.computeIfAbsent(id, k -> new HashMap<>());
        return node;
    }

    /**
     * Designates the entry node. Calling it again reassigns the entry.
     *
     * @throws UnknownNodeException if the node was never registered
     */
    public void setEntry(String id) {
        requireId(id, "entry id");
        requireRegistered(id, "setEntry");
        this.entryId = id;
    }

    /**
     * Adds an edge. An existing edge in the same slot of the source node
     * (same kind, and same key for keyed kinds) is replaced.
     *
     * @return the edge as stored, with its declaration sequence number
     * @throws UnknownNodeException if either endpoint was never registered
     */
    public FlowEdge addEdge(String sourceId, String targetId, EdgeKind kind) {
        requireId(sourceId, "source id");
        requireId(targetId, "target id");
        if (kind == null) {
            throw new IllegalArgumentException("edge kind is required");
        }
        requireRegistered(sourceId, "addEdge source");
        requireRegistered(targetId, "addEdge target");

        var edge = new FlowEdge(sourceId, targetId, kind, nextEdgeSequence++);
        outgoing.get(sourceId).put(kind.slotKey(), edge);
        return edge;
    }

    // ==================== Queries ====================

    /**
     * Outgoing edges of a node ordered by declaration sequence.
     *
     * @throws UnknownNodeException if the node was never registered
     */
    public List<FlowEdge> outgoingEdges(String nodeId) {
        requireRegistered(nodeId, "outgoingEdges");
        return sortedEdges(outgoing.get(nodeId).values());
    }

    public Optional<String> entry() {
        return Optional.ofNullable(entryId);
    }

    /**
     * @throws MissingEntryException if no entry was declared
     */
    public String requireEntry() {
        if (entryId == null) {
            throw new MissingEntryException();
        }
        return entryId;
    }

    public Optional<FlowNode> node(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public boolean containsNode(String id) {
        return id != null && nodes.containsKey(id);
    }

    /**
     * All nodes in registration order.
     */
    public List<FlowNode> nodes() {
        return nodes.values().stream()
                .sorted(BY_REGISTRATION)
                .toList();
    }

    /**
     * All edges in declaration order.
     */
    public List<FlowEdge> allEdges() {
        return outgoing.values().stream()
                .flatMap(slots -> slots.values().stream())
                .sorted(BY_SEQUENCE)
                .toList();
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return outgoing.values().stream()
                .mapToInt(Map::size)
                .sum();
    }

    // ==================== Helper Methods ====================

    private List<FlowEdge> sortedEdges(Collection<FlowEdge> edges) {
        return edges.stream()
                .sorted(BY_SEQUENCE)
                .toList();
    }

    private void requireRegistered(String id, String operation) {
        if (!containsNode(id)) {
            throw new UnknownNodeException(id, operation);
        }
    }

    private static void requireId(String id, String what) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException(what + " must not be blank");
        }
    }
}
