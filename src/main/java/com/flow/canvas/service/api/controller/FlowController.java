package com.flow.canvas.service.api.controller;

import com.flow.canvas.service.api.dto.AnalysisResponse;
import com.flow.canvas.service.api.dto.ApiResponse;
import com.flow.canvas.service.api.dto.CompileResponse;
import com.flow.canvas.service.api.dto.FlowGraphRequest;
import com.flow.canvas.service.api.dto.FlowStatsResponse;
import com.flow.canvas.service.api.dto.LayoutResponse;
import com.flow.canvas.service.api.dto.ValidationIssueResponse;
import com.flow.canvas.service.engine.CompiledFlow;
import com.flow.canvas.service.engine.FlowCompiler;
import com.flow.canvas.service.engine.FlowGraphAssembler;
import com.flow.canvas.service.engine.FlowStatistics;
import com.flow.canvas.service.graph.NodeCategory;
import com.flow.canvas.service.layout.CanvasLayout;
import com.flow.canvas.service.layout.NodePlacement;
import com.flow.canvas.service.validation.ValidationReport;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Controller for flow graph build passes.
 *
 * Every request carries the whole graph; nothing is kept between calls.
 */
@Slf4j
@RestController
@RequestMapping("/flows")
@Tag(name = "Flow Canvas", description = "Layout, validation and compilation of call-flow graphs")
@RequiredArgsConstructor
public class FlowController {

    private final FlowGraphAssembler assembler;
    private final FlowCompiler compiler;

    @PostMapping("/layout")
    @Operation(summary = "Lay out a flow graph", description = "Computes grid cells and pixel positions for every node")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Layout computed"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid graph")
    })
    public ResponseEntity<ApiResponse<LayoutResponse>> layout(@Valid @RequestBody FlowGraphRequest request) {
        log.debug("Layout requested for graph: {}", request.getGraphId());

        var graph = assembler.assemble(request);
        var layout = compiler.layout(graph);

        return ResponseEntity.ok(ApiResponse.success(toLayoutResponse(request.getGraphId(), graph.requireEntry(), layout)));
    }

    @PostMapping("/analyze")
    @Operation(summary = "Analyze a flow graph", description = "Reports structural issues without failing")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Analysis completed"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid graph")
    })
    public ResponseEntity<ApiResponse<AnalysisResponse>> analyze(@Valid @RequestBody FlowGraphRequest request) {
        log.debug("Analysis requested for graph: {}", request.getGraphId());

        var report = compiler.analyze(assembler.assemble(request));
        return ResponseEntity.ok(ApiResponse.success(toAnalysisResponse(request.getGraphId(), report)));
    }

    @PostMapping("/validate")
    @Operation(summary = "Validate a flow graph", description = "Fails with every structural issue if any was found")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Graph is valid"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid graph"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "422", description = "Graph has structural issues")
    })
    public ResponseEntity<ApiResponse<AnalysisResponse>> validate(@Valid @RequestBody FlowGraphRequest request) {
        log.debug("Validation requested for graph: {}", request.getGraphId());

        var report = compiler.validate(assembler.assemble(request));

        log.info("Graph validated: {}", request.getGraphId());
        return ResponseEntity.ok(ApiResponse.success(toAnalysisResponse(request.getGraphId(), report)));
    }

    @PostMapping("/compile")
    @Operation(summary = "Compile a flow graph", description = "Validates, then lays out the graph for serialization")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Graph compiled"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid graph"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "422", description = "Graph has structural issues")
    })
    public ResponseEntity<ApiResponse<CompileResponse>> compile(@Valid @RequestBody FlowGraphRequest request) {
        log.debug("Compile requested for graph: {}", request.getGraphId());

        var compiled = compiler.compile(assembler.assemble(request));
        return ResponseEntity.ok(ApiResponse.success(toCompileResponse(request.getGraphId(), compiled)));
    }

    @PostMapping("/stats")
    @Operation(summary = "Get flow statistics", description = "Node counts, error-handler coverage and canvas size")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Statistics computed"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid graph")
    })
    public ResponseEntity<ApiResponse<FlowStatsResponse>> stats(@Valid @RequestBody FlowGraphRequest request) {
        log.debug("Statistics requested for graph: {}", request.getGraphId());

        var stats = compiler.stats(assembler.assemble(request));
        return ResponseEntity.ok(ApiResponse.success(toStatsResponse(request.getGraphId(), stats)));
    }

    // ==================== Response Mapping ====================

    private LayoutResponse toLayoutResponse(String graphId, String entryNodeId, CanvasLayout layout) {
        return LayoutResponse.builder()
                .graphId(graphId)
                .entryNodeId(entryNodeId)
                .placements(layout.placements().stream().map(this::toPlacementResponse).toList())
                .positions(layout.positions())
                .canvas(layout.canvas())
                .collisionsResolved(layout.collisionsResolved())
                .build();
    }

    private LayoutResponse.PlacementResponse toPlacementResponse(NodePlacement placement) {
        return LayoutResponse.PlacementResponse.builder()
                .nodeId(placement.nodeId())
                .level(placement.level())
                .row(placement.row())
                .x(placement.x())
                .y(placement.y())
                .build();
    }

    private AnalysisResponse toAnalysisResponse(String graphId, ValidationReport report) {
        return AnalysisResponse.builder()
                .graphId(graphId)
                .valid(report.isClean())
                .issueCount(report.size())
                .issues(ValidationIssueResponse.fromAll(report.issues()))
                .summary(report.describe())
                .build();
    }

    private CompileResponse toCompileResponse(String graphId, CompiledFlow compiled) {
        return CompileResponse.builder()
                .graphId(graphId)
                .entryNodeId(compiled.entryNodeId())
                .valid(compiled.report().isClean())
                .positions(compiled.layout().positions())
                .canvas(compiled.layout().canvas())
                .issues(ValidationIssueResponse.fromAll(compiled.report().issues()))
                .build();
    }

    private FlowStatsResponse toStatsResponse(String graphId, FlowStatistics stats) {
        Map<String, Long> byCategory = new LinkedHashMap<>();
        for (Map.Entry<NodeCategory, Long> entry : stats.nodesByCategory().entrySet()) {
            byCategory.put(entry.getKey().name(), entry.getValue());
        }

        return FlowStatsResponse.builder()
                .graphId(graphId)
                .totalNodes(stats.totalNodes())
                .totalEdges(stats.totalEdges())
                .nodesByCategory(byCategory)
                .errorHandlerCoverage(FlowStatsResponse.ErrorHandlerCoverage.builder()
                        .nodesWithHandlers(stats.nodesWithHandlers())
                        .nodesRequiringHandlers(stats.nodesRequiringHandlers())
                        .coveragePercent(stats.coveragePercent())
                        .build())
                .canvas(stats.canvas())
                .validationStatus(stats.validationStatus().name())
                .build();
    }
}
