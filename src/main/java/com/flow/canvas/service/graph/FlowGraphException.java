package com.flow.canvas.service.graph;

/**
 * Base exception for malformed calls against a {@link FlowGraph}.
 *
 * These indicate a defect in the caller building the graph, never a problem
 * with the flow design itself.
 */
public class FlowGraphException extends RuntimeException {

    private final String nodeId;
    private final String errorCode;

    public FlowGraphException(String message, String nodeId, String errorCode) {
        super(message);
        this.nodeId = nodeId;
        this.errorCode = errorCode;
    }

    public String getNodeId() {
        return nodeId;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
