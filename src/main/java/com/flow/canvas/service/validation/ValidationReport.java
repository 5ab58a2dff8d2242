package com.flow.canvas.service.validation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Ordered, immutable list of issues found in one analysis pass.
 */
public record ValidationReport(List<ValidationIssue> issues) {

    private static final String NO_ISSUES = "  No issues found";

    public ValidationReport {
        issues = List.copyOf(issues);
    }

    public static ValidationReport empty() {
        return new ValidationReport(List.of());
    }

    public boolean isClean() {
        return issues.isEmpty();
    }

    public int size() {
        return issues.size();
    }

    public List<ValidationIssue> issuesFor(ValidationRule rule) {
        return issues.stream()
                .filter(issue -> issue.rule() == rule)
                .toList();
    }

    public List<String> orphanedNodes() {
        return nodeIdsFor(ValidationRule.ORPHANED_NODE);
    }

    public List<String> unterminatedNodes() {
        return nodeIdsFor(ValidationRule.UNTERMINATED_PATH);
    }

    /**
     * Input-collecting node id to the error names it is missing, in report order.
     */
    public Map<String, List<String>> missingErrorHandlers() {
        return issuesFor(ValidationRule.MISSING_ERROR_HANDLER).stream()
                .collect(Collectors.groupingBy(
                        ValidationIssue::nodeId,
                        LinkedHashMap::new,
                        Collectors.mapping(ValidationIssue::detail, Collectors.toList())));
    }

    /**
     * Multi-line human-readable summary grouped by rule.
     */
    public String describe() {
        if (isClean()) {
            return NO_ISSUES;
        }

        var lines = new ArrayList<String>();
        for (var rule : ValidationRule.values()) {
            var ruleIssues = issuesFor(rule);
            if (ruleIssues.isEmpty()) {
                continue;
            }
            lines.add("  %s (%d):".formatted(rule.getTitle(), ruleIssues.size()));
            ruleIssues.forEach(issue -> lines.add("    - %s: %s".formatted(issue.nodeId(), issue.detail())));
            lines.add("    Suggestion: " + rule.getSuggestion());
        }
        return String.join("\n", lines);
    }

    private List<String> nodeIdsFor(ValidationRule rule) {
        return issuesFor(rule).stream()
                .map(ValidationIssue::nodeId)
                .toList();
    }
}
