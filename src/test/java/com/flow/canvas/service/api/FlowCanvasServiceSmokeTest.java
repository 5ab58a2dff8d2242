package com.flow.canvas.service.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flow.canvas.service.api.dto.FlowGraphRequest;
import com.flow.canvas.service.graph.EdgeKind;
import com.flow.canvas.service.graph.NodeCategory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Smoke tests for Flow Canvas Service.
 *
 * Tests basic functionality of all endpoints.
 */
@SpringBootTest
@AutoConfigureMockMvc
class FlowCanvasServiceSmokeTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void contextLoads() {
        // Context loads successfully
    }

    @Test
    void healthEndpointWorks() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").exists());
    }

    @Test
    void swaggerUiAvailable() throws Exception {
        mockMvc.perform(get("/swagger-ui.html"))
                .andExpect(status().is3xxRedirection());
    }

    @Test
    void apiDocsDescribeFlowEndpoints() throws Exception {
        mockMvc.perform(get("/v3/api-docs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.info.title").value("Flow Canvas Service API"))
                .andExpect(jsonPath("$.paths['/flows/layout']").exists());
    }

    @Test
    void layout_metadataAndEditorFields_areAccepted() throws Exception {
        String body = """
                {
                  "graphId": "with-metadata",
                  "metadata": {"author": "designer", "revision": 3},
                  "nodes": [{"nodeId": "A", "category": "TERMINAL", "label": "Goodbye"}],
                  "edges": []
                }
                """;

        mockMvc.perform(post("/flows/layout")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.positions.A.x").value(150));
    }

    @Test
    void layout_validRequest_returns200() throws Exception {
        mockMvc.perform(post("/flows/layout")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(twoNodeFlow())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.entryNodeId").value("A"))
                .andExpect(jsonPath("$.data.positions.A.x").value(150))
                .andExpect(jsonPath("$.data.positions.B.x").value(430))
                .andExpect(jsonPath("$.data.positions.B.y").value(50));
    }

    @Test
    void layout_missingGraphId_returns400() throws Exception {
        FlowGraphRequest request = twoNodeFlow();
        request.setGraphId(null);

        mockMvc.perform(post("/flows/layout")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
    }

    @Test
    void layout_unknownEdgeTarget_returns400() throws Exception {
        FlowGraphRequest request = twoNodeFlow();
        request.getEdges().get(0).setTargetNodeId("ghost");

        mockMvc.perform(post("/flows/layout")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("UNKNOWN_NODE"));
    }

    @Test
    void layout_unknownEntry_returns400() throws Exception {
        FlowGraphRequest request = twoNodeFlow();
        request.setEntryNodeId("nowhere");

        mockMvc.perform(post("/flows/layout")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("UNKNOWN_NODE"));
    }

    @Test
    void layout_emptyGraph_returns400() throws Exception {
        FlowGraphRequest request = FlowGraphRequest.builder()
                .graphId("empty")
                .nodes(List.of())
                .edges(List.of())
                .build();

        mockMvc.perform(post("/flows/layout")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("MISSING_ENTRY"));
    }

    @Test
    void layout_nullListEntries_returns400() throws Exception {
        String body = """
                {
                  "graphId": "null-entries",
                  "nodes": [{"nodeId": "A", "category": "TERMINAL"}, null],
                  "edges": [null]
                }
                """;

        mockMvc.perform(post("/flows/layout")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
    }

    @Test
    void layout_keyedEdgeWithoutKey_returns400() throws Exception {
        FlowGraphRequest request = twoNodeFlow();
        request.getEdges().get(0).setKind(EdgeKind.Type.CONDITIONAL);

        mockMvc.perform(post("/flows/layout")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INVALID_ARGUMENT"));
    }

    @Test
    void validate_cleanFlow_returns200() throws Exception {
        mockMvc.perform(post("/flows/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(twoNodeFlow())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.valid").value(true))
                .andExpect(jsonPath("$.data.issueCount").value(0));
    }

    @Test
    void validate_deadEnd_returns422() throws Exception {
        FlowGraphRequest request = twoNodeFlow();
        request.getNodes().get(1).setCategory(NodeCategory.SIMPLE);

        mockMvc.perform(post("/flows/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("FLOW_VALIDATION_FAILED"))
                .andExpect(jsonPath("$.data[0].rule").value("UNTERMINATED_PATH"))
                .andExpect(jsonPath("$.data[0].nodeId").value("B"));
    }

    private FlowGraphRequest twoNodeFlow() {
        return FlowGraphRequest.builder()
                .graphId("smoke-flow")
                .entryNodeId("A")
                .nodes(List.of(
                        FlowGraphRequest.NodeDto.builder()
                                .nodeId("A")
                                .category(NodeCategory.SIMPLE)
                                .build(),
                        FlowGraphRequest.NodeDto.builder()
                                .nodeId("B")
                                .category(NodeCategory.TERMINAL)
                                .build()
                ))
                .edges(List.of(
                        FlowGraphRequest.EdgeDto.builder()
                                .sourceNodeId("A")
                                .targetNodeId("B")
                                .kind(EdgeKind.Type.SEQUENTIAL)
                                .build()
                ))
                .build();
    }
}
