package com.flow.canvas.service.graph;

/**
 * Thrown when an operation references a node that was never registered.
 */
public class UnknownNodeException extends FlowGraphException {

    public static final String ERROR_CODE = "UNKNOWN_NODE";

    public UnknownNodeException(String nodeId, String operation) {
        super("Unknown node '%s' referenced by %s".formatted(nodeId, operation), nodeId, ERROR_CODE);
    }
}
