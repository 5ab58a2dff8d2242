package com.flow.canvas.service.api.dto;

import com.flow.canvas.service.layout.CanvasDimensions;
import com.flow.canvas.service.layout.NodePosition;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * DTO for a compiled flow: presentation positions plus the validation outcome,
 * ready to be embedded by a serializer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompileResponse {

    private String graphId;
    private String entryNodeId;
    private boolean valid;
    private Map<String, NodePosition> positions;
    private CanvasDimensions canvas;
    private List<ValidationIssueResponse> issues;
}
