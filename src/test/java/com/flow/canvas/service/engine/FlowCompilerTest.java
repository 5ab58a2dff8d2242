package com.flow.canvas.service.engine;

import com.flow.canvas.service.config.FlowConfig;
import com.flow.canvas.service.config.MetricsConfig;
import com.flow.canvas.service.graph.EdgeKind;
import com.flow.canvas.service.graph.FlowGraph;
import com.flow.canvas.service.graph.NodeCategory;
import com.flow.canvas.service.layout.CanvasDimensions;
import com.flow.canvas.service.layout.CanvasLayoutEngine;
import com.flow.canvas.service.validation.FlowValidationException;
import com.flow.canvas.service.validation.FlowValidator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class FlowCompilerTest {

    private SimpleMeterRegistry registry;
    private FlowConfig flowConfig;
    private FlowCompiler compiler;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        flowConfig = new FlowConfig();
        compiler = new FlowCompiler(new CanvasLayoutEngine(), new FlowValidator(),
                new MetricsConfig(registry), flowConfig);
    }

    @Test
    void compile_cleanGraph_returnsPositions() {
        var compiled = compiler.compile(cleanGraph());

        assertThat(compiled.entryNodeId()).isEqualTo("A");
        assertThat(compiled.report().isClean()).isTrue();
        assertThat(compiled.layout().positions()).containsOnlyKeys("A", "B");
        assertThat(counter("flow.compile.count")).isEqualTo(1.0);
        assertThat(counter("flow.layout.count")).isEqualTo(1.0);
    }

    @Test
    void compile_strict_failsOnIssues() {
        assertThatThrownBy(() -> compiler.compile(partiallyHandledGraph()))
                .isInstanceOf(FlowValidationException.class);

        assertThat(counter("flow.validation.failed.count")).isEqualTo(1.0);
        assertThat(counter("flow.compile.count")).isZero();
    }

    @Test
    @DisplayName("Non-strict compile lays out the flow and carries the issues")
    void compile_lenient_returnsIssues() {
        flowConfig.getFeatures().setStrictCompile(false);

        var compiled = compiler.compile(partiallyHandledGraph());

        assertThat(compiled.report().size()).isEqualTo(3);
        assertThat(compiled.layout().placements()).hasSize(3);
    }

    @Test
    void stats_reportsCoverageAndStatus() {
        var stats = compiler.stats(partiallyHandledGraph());

        assertThat(stats.totalNodes()).isEqualTo(3);
        assertThat(stats.totalEdges()).isEqualTo(5);
        assertThat(stats.nodesByCategory()).containsExactly(
                entry(NodeCategory.TERMINAL, 1L),
                entry(NodeCategory.INPUT_COLLECTING, 2L));
        assertThat(stats.nodesRequiringHandlers()).isEqualTo(2);
        assertThat(stats.nodesWithHandlers()).isEqualTo(1);
        assertThat(stats.coveragePercent()).isEqualTo(50.0);
        assertThat(stats.validationStatus()).isEqualTo(FlowStatistics.ValidationStatus.FAILED);
    }

    @Test
    void stats_withoutInputNodes_hasFullCoverage() {
        var stats = compiler.stats(cleanGraph());

        assertThat(stats.coveragePercent()).isEqualTo(100.0);
        assertThat(stats.canvas()).isEqualTo(new CanvasDimensions(480, 100));
        assertThat(stats.validationStatus()).isEqualTo(FlowStatistics.ValidationStatus.PASSED);
    }

    // ==================== Helpers ====================

    private double counter(String name) {
        return registry.get(name).counter().count();
    }

    private FlowGraph cleanGraph() {
        var graph = new FlowGraph();
        graph.addNode("A", NodeCategory.SIMPLE);
        graph.addNode("B", NodeCategory.TERMINAL);
        graph.addEdge("A", "B", EdgeKind.sequential());
        graph.setEntry("A");
        return graph;
    }

    /**
     * M handles every mandatory error; N handles none.
     */
    private FlowGraph partiallyHandledGraph() {
        var graph = new FlowGraph();
        graph.addNode("M", NodeCategory.INPUT_COLLECTING);
        graph.addNode("N", NodeCategory.INPUT_COLLECTING);
        graph.addNode("T", NodeCategory.TERMINAL);
        FlowValidator.DEFAULT_MANDATORY_ERROR_HANDLERS
                .forEach(errorType -> graph.addEdge("M", "T", EdgeKind.errorHandler(errorType)));
        graph.addEdge("M", "N", EdgeKind.sequential());
        graph.addEdge("N", "T", EdgeKind.sequential());
        graph.setEntry("M");
        return graph;
    }
}
