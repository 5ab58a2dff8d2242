package com.flow.canvas.service.validation;

/**
 * One structural problem found in a flow graph.
 *
 * @param rule   rule that produced the issue
 * @param nodeId offending node
 * @param detail human-readable detail (for missing handlers, the missing error name)
 */
public record ValidationIssue(
        ValidationRule rule,
        String nodeId,
        String detail
) {

    @Override
    public String toString() {
        return "%s [%s]: %s".formatted(rule, nodeId, detail);
    }
}
