package com.flow.canvas.service.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * DTO for structural analysis results.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisResponse {

    private String graphId;
    private boolean valid;
    private int issueCount;
    private List<ValidationIssueResponse> issues;

    /**
     * Human-readable report grouped by rule.
     */
    private String summary;
}
