package com.flow.canvas.service.validation;

import com.flow.canvas.service.graph.EdgeKind;
import com.flow.canvas.service.graph.FlowEdge;
import com.flow.canvas.service.graph.FlowGraph;
import com.flow.canvas.service.graph.FlowNode;
import com.flow.canvas.service.graph.NodeCategory;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Structural validator for flow graphs.
 *
 * Evaluates three independent rules against the same graph and aggregates
 * every finding into one report:
 * - orphaned nodes (unreachable from the entry over any edge kind)
 * - unterminated paths (non-terminal nodes without outgoing edges)
 * - missing mandatory error handlers on input-collecting nodes
 *
 * Cycles are legal and never reported.
 */
@Slf4j
public class FlowValidator {

    /**
     * Error types every input-collecting node must handle.
     */
    public static final List<String> DEFAULT_MANDATORY_ERROR_HANDLERS = List.of(
            "InputTimeLimitExceeded",
            "NoMatchingCondition",
            "NoMatchingError"
    );

    private final List<String> mandatoryErrorHandlers;

    public FlowValidator() {
        this(DEFAULT_MANDATORY_ERROR_HANDLERS);
    }

    public FlowValidator(List<String> mandatoryErrorHandlers) {
        this.mandatoryErrorHandlers = List.copyOf(mandatoryErrorHandlers);
    }

    public List<String> getMandatoryErrorHandlers() {
        return mandatoryErrorHandlers;
    }

    // ==================== Public API ====================

    /**
     * Runs every rule and returns all findings. Never fails on structural issues.
     *
     * @throws com.flow.canvas.service.graph.MissingEntryException if the graph has no entry
     */
    public ValidationReport analyze(FlowGraph graph) {
        var entryId = graph.requireEntry();

        var issues = new ArrayList<ValidationIssue>();
        issues.addAll(findOrphanedNodes(graph, entryId));
        issues.addAll(findUnterminatedPaths(graph));
        issues.addAll(findMissingErrorHandlers(graph));

        log.debug("Analyzed graph with {} nodes: {} issue(s)", graph.nodeCount(), issues.size());
        return new ValidationReport(issues);
    }

    /**
     * Analyzes the graph and fails once, listing every issue, if any was found.
     *
     * @return the clean report
     * @throws FlowValidationException if the report is not clean
     */
    public ValidationReport validate(FlowGraph graph) {
        var report = analyze(graph);
        if (!report.isClean()) {
            log.warn("Flow validation failed with {} issue(s)", report.size());
            throw new FlowValidationException(report);
        }
        return report;
    }

    // ==================== Orphan Detection ====================

    private List<ValidationIssue> findOrphanedNodes(FlowGraph graph, String entryId) {
        var reachable = collectReachable(graph, entryId);

        return graph.nodes().stream()
                .map(FlowNode::id)
                .filter(id -> !reachable.contains(id))
                .map(id -> new ValidationIssue(ValidationRule.ORPHANED_NODE, id,
                        "Node is not reachable from entry node " + entryId))
                .toList();
    }

    private Set<String> collectReachable(FlowGraph graph, String entryId) {
        var reachable = new HashSet<String>();
        var queue = new ArrayDeque<String>();
        reachable.add(entryId);
        queue.add(entryId);

        while (!queue.isEmpty()) {
            for (var edge : graph.outgoingEdges(queue.poll())) {
                if (reachable.add(edge.targetId())) {
                    queue.add(edge.targetId());
                }
            }
        }
        return reachable;
    }

    // ==================== Unterminated Paths ====================

    private List<ValidationIssue> findUnterminatedPaths(FlowGraph graph) {
        return graph.nodes().stream()
                .filter(node -> !node.isTerminal())
                .filter(node -> graph.outgoingEdges(node.id()).isEmpty())
                .map(node -> new ValidationIssue(ValidationRule.UNTERMINATED_PATH, node.id(),
                        "%s node has no outgoing transition".formatted(node.category())))
                .toList();
    }

    // ==================== Mandatory Error Handlers ====================

    private List<ValidationIssue> findMissingErrorHandlers(FlowGraph graph) {
        var issues = new ArrayList<ValidationIssue>();
        for (var node : graph.nodes()) {
            if (node.category() == NodeCategory.INPUT_COLLECTING) {
                issues.addAll(missingHandlersOf(graph, node));
            }
        }
        return issues;
    }

    private List<ValidationIssue> missingHandlersOf(FlowGraph graph, FlowNode node) {
        var handled = handledErrorTypes(graph.outgoingEdges(node.id()));

        return mandatoryErrorHandlers.stream()
                .filter(errorType -> !handled.contains(errorType))
                .map(errorType -> new ValidationIssue(ValidationRule.MISSING_ERROR_HANDLER, node.id(), errorType))
                .toList();
    }

    private Set<String> handledErrorTypes(List<FlowEdge> edges) {
        return edges.stream()
                .map(FlowEdge::kind)
                .filter(EdgeKind.ErrorHandler.class::isInstance)
                .map(EdgeKind::key)
                .collect(Collectors.toSet());
    }
}
