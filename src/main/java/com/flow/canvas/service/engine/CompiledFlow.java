package com.flow.canvas.service.engine;

import com.flow.canvas.service.layout.CanvasLayout;
import com.flow.canvas.service.validation.ValidationReport;

/**
 * Output of one compile pass, handed to the serializer.
 *
 * @param entryNodeId entry node of the flow
 * @param layout      computed canvas layout
 * @param report      validation report; always clean under strict compilation
 */
public record CompiledFlow(
        String entryNodeId,
        CanvasLayout layout,
        ValidationReport report
) {}
