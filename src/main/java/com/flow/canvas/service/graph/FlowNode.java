package com.flow.canvas.service.graph;

/**
 * Minimal node descriptor: identifier, category and registration order.
 *
 * @param id       opaque node identifier
 * @param category category tag supplied by the assembler
 * @param sequence registration sequence number within its graph
 */
public record FlowNode(
        String id,
        NodeCategory category,
        long sequence
) {

    public boolean isTerminal() {
        return category == NodeCategory.TERMINAL;
    }
}
