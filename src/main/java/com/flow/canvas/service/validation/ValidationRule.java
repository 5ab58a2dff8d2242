package com.flow.canvas.service.validation;

/**
 * Structural rules evaluated by {@link FlowValidator}, in report order.
 */
public enum ValidationRule {

    ORPHANED_NODE("Orphaned nodes",
            "Ensure every node is reachable from the entry node. Remove unused nodes or connect them to the flow."),

    UNTERMINATED_PATH("Unterminated paths",
            "Give every non-terminal node an outgoing transition. Paths must end in a terminal node."),

    MISSING_ERROR_HANDLER("Missing error handlers",
            "Add an error handler transition for every mandatory error type on input-collecting nodes.");

    private final String title;
    private final String suggestion;

    ValidationRule(String title, String suggestion) {
        this.title = title;
        this.suggestion = suggestion;
    }

    public String getTitle() {
        return title;
    }

    public String getSuggestion() {
        return suggestion;
    }
}
