package com.flow.canvas.service.api.dto;

import com.flow.canvas.service.validation.ValidationIssue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One structural issue, as returned to API callers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationIssueResponse {

    private String rule;
    private String nodeId;
    private String detail;

    public static ValidationIssueResponse from(ValidationIssue issue) {
        return ValidationIssueResponse.builder()
                .rule(issue.rule().name())
                .nodeId(issue.nodeId())
                .detail(issue.detail())
                .build();
    }

    public static List<ValidationIssueResponse> fromAll(List<ValidationIssue> issues) {
        return issues.stream()
                .map(ValidationIssueResponse::from)
                .toList();
    }
}
