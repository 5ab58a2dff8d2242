package com.flow.canvas.service.engine;

import com.flow.canvas.service.api.dto.FlowGraphRequest;
import com.flow.canvas.service.api.dto.FlowGraphRequest.EdgeDto;
import com.flow.canvas.service.api.dto.FlowGraphRequest.NodeDto;
import com.flow.canvas.service.graph.EdgeKind;
import com.flow.canvas.service.graph.FlowEdge;
import com.flow.canvas.service.graph.FlowNode;
import com.flow.canvas.service.graph.NodeCategory;
import com.flow.canvas.service.graph.UnknownNodeException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FlowGraphAssemblerTest {

    private final FlowGraphAssembler assembler = new FlowGraphAssembler();

    @Test
    void assemble_registersNodesAndEdgesInListOrder() {
        var request = request("main", "menu",
                List.of(node("menu", NodeCategory.INPUT_COLLECTING),
                        node("sales", NodeCategory.TERMINAL),
                        node("support", NodeCategory.TERMINAL)),
                List.of(edge("menu", "support", EdgeKind.Type.INTENT_BRANCH, "support"),
                        edge("menu", "sales", EdgeKind.Type.CONDITIONAL, "1")));

        var graph = assembler.assemble(request);

        assertThat(graph.requireEntry()).isEqualTo("menu");
        assertThat(graph.nodes()).extracting(FlowNode::id).containsExactly("menu", "sales", "support");
        assertThat(graph.outgoingEdges("menu"))
                .extracting(FlowEdge::kind)
                .containsExactly(EdgeKind.intentBranch("support"), EdgeKind.conditional("1"));
    }

    @Test
    void assemble_withoutEntry_usesFirstNode() {
        var request = request("main", null,
                List.of(node("start", NodeCategory.SIMPLE), node("end", NodeCategory.TERMINAL)),
                List.of(edge("start", "end", EdgeKind.Type.SEQUENTIAL, null)));

        assertThat(assembler.assemble(request).requireEntry()).isEqualTo("start");
    }

    @Test
    void assemble_withoutNodes_leavesEntryUnset() {
        var graph = assembler.assemble(request("empty", null, List.of(), List.of()));

        assertThat(graph.entry()).isEmpty();
        assertThat(graph.nodeCount()).isZero();
    }

    @Test
    void assemble_unknownEdgeTarget_fails() {
        var request = request("main", "a",
                List.of(node("a", NodeCategory.SIMPLE)),
                List.of(edge("a", "missing", EdgeKind.Type.SEQUENTIAL, null)));

        assertThatThrownBy(() -> assembler.assemble(request))
                .isInstanceOf(UnknownNodeException.class);
    }

    @Test
    void assemble_keyedKindWithoutKey_fails() {
        var request = request("main", "a",
                List.of(node("a", NodeCategory.INPUT_COLLECTING), node("b", NodeCategory.TERMINAL)),
                List.of(edge("a", "b", EdgeKind.Type.ERROR_HANDLER, "")));

        assertThatThrownBy(() -> assembler.assemble(request))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private FlowGraphRequest request(String graphId, String entry, List<NodeDto> nodes, List<EdgeDto> edges) {
        return FlowGraphRequest.builder()
                .graphId(graphId)
                .entryNodeId(entry)
                .nodes(nodes)
                .edges(edges)
                .build();
    }

    private NodeDto node(String id, NodeCategory category) {
        return NodeDto.builder().nodeId(id).category(category).build();
    }

    private EdgeDto edge(String source, String target, EdgeKind.Type kind, String key) {
        return EdgeDto.builder().sourceNodeId(source).targetNodeId(target).kind(kind).key(key).build();
    }
}
