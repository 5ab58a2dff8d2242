package com.flow.canvas.service.graph;

/**
 * Category tag supplied by the assembler for every node.
 *
 * Drives validator rules only; layout treats all categories alike.
 */
public enum NodeCategory {

    /**
     * The call ends here (disconnect, transfer, end of flow).
     */
    TERMINAL,

    /**
     * Requires a caller response and must carry the mandatory error handlers.
     */
    INPUT_COLLECTING,

    /**
     * Non-input decision.
     */
    BRANCHING,

    /**
     * Single successor expected.
     */
    SIMPLE
}
