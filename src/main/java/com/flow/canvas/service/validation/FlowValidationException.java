package com.flow.canvas.service.validation;

import java.util.List;

/**
 * Thrown once by {@link FlowValidator#validate} with every issue of the pass.
 */
public class FlowValidationException extends RuntimeException {

    public static final String ERROR_CODE = "FLOW_VALIDATION_FAILED";

    private final ValidationReport report;

    public FlowValidationException(ValidationReport report) {
        super("Flow validation failed with " + report.size() + " issue(s):\n" + report.describe());
        this.report = report;
    }

    public ValidationReport getReport() {
        return report;
    }

    public List<ValidationIssue> getIssues() {
        return report.issues();
    }

    public String getErrorCode() {
        return ERROR_CODE;
    }
}
