package com.flow.canvas.service.graph;

/**
 * Thrown when layout or validation is invoked on a graph without a declared entry.
 */
public class MissingEntryException extends FlowGraphException {

    public static final String ERROR_CODE = "MISSING_ENTRY";

    public MissingEntryException() {
        super("Flow graph has no entry node", null, ERROR_CODE);
    }
}
