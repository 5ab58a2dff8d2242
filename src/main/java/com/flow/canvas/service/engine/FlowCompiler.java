package com.flow.canvas.service.engine;

import com.flow.canvas.service.config.FlowConfig;
import com.flow.canvas.service.config.MetricsConfig;
import com.flow.canvas.service.engine.FlowStatistics.ValidationStatus;
import com.flow.canvas.service.graph.FlowGraph;
import com.flow.canvas.service.graph.FlowNode;
import com.flow.canvas.service.graph.NodeCategory;
import com.flow.canvas.service.layout.CanvasLayout;
import com.flow.canvas.service.layout.CanvasLayoutEngine;
import com.flow.canvas.service.validation.FlowValidationException;
import com.flow.canvas.service.validation.FlowValidator;
import com.flow.canvas.service.validation.ValidationReport;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Orchestrates one build pass over a flow graph.
 *
 * Layout and validation stay independent; this adapter only sequences them
 * for compilation and statistics and records metrics. Holds no per-graph state.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FlowCompiler {

    private static final double FULL_COVERAGE = 100.0;

    private final CanvasLayoutEngine layoutEngine;
    private final FlowValidator validator;
    private final MetricsConfig metricsConfig;
    private final FlowConfig flowConfig;

    // ==================== Public API ====================

    /**
     * Computes the canvas layout of the graph.
     */
    public CanvasLayout layout(FlowGraph graph) {
        var sample = Timer.start(metricsConfig.getRegistry());
        try {
            var layout = layoutEngine.layout(graph);
            metricsConfig.getLayoutsCompleted().increment();
            log.info("Layout completed: nodes={}, canvas={}x{}",
                    layout.placements().size(), layout.canvas().width(), layout.canvas().height());
            return layout;
        } finally {
            sample.stop(metricsConfig.getLayoutTimer());
        }
    }

    /**
     * Runs structural analysis without failing on issues.
     */
    public ValidationReport analyze(FlowGraph graph) {
        var sample = Timer.start(metricsConfig.getRegistry());
        try {
            var report = validator.analyze(graph);
            recordAnalysis(report);
            return report;
        } finally {
            sample.stop(metricsConfig.getValidationTimer());
        }
    }

    /**
     * Runs structural analysis and fails with every issue if any was found.
     *
     * @throws com.flow.canvas.service.validation.FlowValidationException if the graph has issues
     */
    public ValidationReport validate(FlowGraph graph) {
        var sample = Timer.start(metricsConfig.getRegistry());
        try {
            var report = validator.validate(graph);
            recordAnalysis(report);
            return report;
        } catch (FlowValidationException e) {
            recordAnalysis(e.getReport());
            throw e;
        } finally {
            sample.stop(metricsConfig.getValidationTimer());
        }
    }

    /**
     * Validates, then lays out the graph. With strict compilation disabled,
     * issues are carried in the result instead of failing the pass.
     */
    public CompiledFlow compile(FlowGraph graph) {
        var report = isStrictCompile() ? validate(graph) : analyze(graph);
        var layout = layout(graph);

        metricsConfig.getCompilesCompleted().increment();
        log.info("Flow compiled: entry={}, nodes={}, issues={}",
                graph.requireEntry(), graph.nodeCount(), report.size());
        return new CompiledFlow(graph.requireEntry(), layout, report);
    }

    /**
     * Collects node counts, error-handler coverage, canvas size and validation status.
     */
    public FlowStatistics stats(FlowGraph graph) {
        var report = analyze(graph);
        var layout = layout(graph);

        int requiring = countInputCollecting(graph);
        int withHandlers = requiring - report.missingErrorHandlers().size();

        return new FlowStatistics(
                graph.nodeCount(),
                graph.edgeCount(),
                countByCategory(graph),
                requiring,
                withHandlers,
                coveragePercent(withHandlers, requiring),
                layout.canvas(),
                report.isClean() ? ValidationStatus.PASSED : ValidationStatus.FAILED
        );
    }

    // ==================== Statistics Helpers ====================

    private Map<NodeCategory, Long> countByCategory(FlowGraph graph) {
        return graph.nodes().stream()
                .collect(Collectors.groupingBy(
                        FlowNode::category,
                        () -> new EnumMap<>(NodeCategory.class),
                        Collectors.counting()));
    }

    private int countInputCollecting(FlowGraph graph) {
        return (int) graph.nodes().stream()
                .filter(node -> node.category() == NodeCategory.INPUT_COLLECTING)
                .count();
    }

    private double coveragePercent(int withHandlers, int requiring) {
        if (requiring == 0) {
            return FULL_COVERAGE;
        }
        return Math.round(withHandlers * 1000.0 / requiring) / 10.0;
    }

    // ==================== Metrics & Logging ====================

    private void recordAnalysis(ValidationReport report) {
        metricsConfig.getValidationsCompleted().increment();
        if (!report.isClean()) {
            metricsConfig.getValidationsFailed().increment();
        }
        log.debug("Analysis completed with {} issue(s)", report.size());
    }

    private boolean isStrictCompile() {
        return flowConfig.getFeatures().isStrictCompile();
    }
}
