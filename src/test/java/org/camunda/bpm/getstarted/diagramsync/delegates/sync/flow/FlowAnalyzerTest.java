package org.camunda.bpm.getstarted.diagramsync.delegates.sync.flow;

import org.camunda.bpm.getstarted.diagramsync.delegates.sync.config.models.FlowConfig;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.Connection;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.DiagramGraph;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.DiagramNode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class FlowAnalyzerTest {
    private final FlowAnalyzer analyzer = new FlowAnalyzer();

    private static DiagramGraph graph(List<String> nodeIds, String... edges) {
        List<DiagramNode> nodes = nodeIds.stream()
                .map(id -> DiagramNode.of(id, "Step " + id))
                .toList();
        List<Connection> connections = new ArrayList<>();
        for (String edge : edges) {
            String[] ends = edge.split("->");
            connections.add(Connection.of(ends[0], ends[1]));
        }
        return new DiagramGraph(nodes, connections);
    }

    private static List<String> ids(List<DiagramNode> nodes) {
        return nodes.stream().map(DiagramNode::id).toList();
    }

    private static Map<String, List<String>> branchIds(FlowStructure flow) {
        return flow.branchesByMainNode().entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, entry -> ids(entry.getValue())));
    }

    @Test
    void shouldHangSideBranchUnderItsMainFlowParent() {
        FlowStructure flow = analyzer.analyze(graph(List.of("1", "2", "3", "6"), "1->2", "2->3", "2->6"));

        assertEquals(List.of("1", "2", "3"), ids(flow.mainFlow()));
        assertEquals(Map.of("2", List.of("6")), branchIds(flow));
        assertTrue(flow.orphans().isEmpty());
    }

    @Test
    void shouldPickLongestPathAsMainFlow() {
        FlowStructure flow = analyzer.analyze(graph(List.of("1", "2", "3", "4", "5"),
                "1->2", "1->5", "2->3", "3->4", "5->4"));

        assertEquals(List.of("1", "2", "3", "4"), ids(flow.mainFlow()));
        assertEquals(Map.of("1", List.of("5")), branchIds(flow));
    }

    @Test
    void shouldProduceSameFlowForSameGraph() {
        DiagramGraph graph = graph(List.of("1", "2", "3", "4", "5", "6"),
                "1->2", "1->3", "2->4", "3->4", "4->5", "4->6");

        FlowStructure first = analyzer.analyze(graph);
        FlowStructure second = analyzer.analyze(graph);

        assertEquals(List.of("1", "2", "4", "5"), ids(first.mainFlow()));
        assertEquals(ids(first.mainFlow()), ids(second.mainFlow()));
        assertEquals(branchIds(first), branchIds(second));
    }

    @Test
    void shouldTryStartNodesInNumericIdOrder() {
        FlowStructure flow = analyzer.analyze(graph(List.of("10", "11", "9", "12"), "10->11", "9->12"));

        assertEquals(List.of("9", "12"), ids(flow.mainFlow()));
        assertEquals(List.of("10", "11"), ids(flow.orphans()));
    }

    @Test
    void shouldAttachNestedBranchToTheSameStep() {
        FlowStructure flow = analyzer.analyze(graph(List.of("1", "2", "3", "4", "6", "7"),
                "1->2", "2->3", "3->4", "2->6", "6->7"));

        assertEquals(List.of("1", "2", "3", "4"), ids(flow.mainFlow()));
        assertEquals(Map.of("2", List.of("6", "7")), branchIds(flow));
    }

    @Test
    void shouldAttachFeederNodeToPredecessorOfItsTarget() {
        FlowStructure flow = analyzer.analyze(graph(List.of("1", "2", "3", "4", "7"),
                "1->2", "2->3", "3->4", "7->3"));

        assertEquals(List.of("1", "2", "3", "4"), ids(flow.mainFlow()));
        assertEquals(Map.of("2", List.of("7")), branchIds(flow));
    }

    @Test
    void shouldReportDisconnectedNodesAsOrphans() {
        FlowStructure flow = analyzer.analyze(graph(List.of("1", "2", "3", "9"), "1->2", "2->3"));

        assertEquals(List.of("1", "2", "3"), ids(flow.mainFlow()));
        assertEquals(List.of("9"), ids(flow.orphans()));
        assertTrue(flow.branchesByMainNode().isEmpty());
    }

    @Test
    void shouldFallBackToTopologicalOrderForCycles() {
        FlowStructure flow = analyzer.analyze(graph(List.of("3", "1", "2"), "1->2", "2->3", "3->1"));

        assertEquals(List.of("1", "2", "3"), ids(flow.mainFlow()));
    }

    @Test
    void shouldKeepNodeOrderWhenThereAreNoConnections() {
        FlowStructure flow = analyzer.analyze(graph(List.of("5", "2", "8"), "2->missing"));

        assertEquals(List.of("5", "2", "8"), ids(flow.mainFlow()));
        assertTrue(flow.orphans().isEmpty());
    }

    @Test
    void shouldReturnEmptyStructureForEmptyGraph() {
        FlowStructure flow = analyzer.analyze(DiagramGraph.empty());

        assertTrue(flow.mainFlow().isEmpty());
        assertTrue(flow.branchesByMainNode().isEmpty());
    }

    @Test
    void shouldStillProduceFlowWhenSearchBudgetIsExhausted() {
        FlowConfig config = new FlowConfig();
        config.maxPathSearchSteps = 1;

        FlowStructure flow = new FlowAnalyzer(config).analyze(graph(List.of("1", "2", "3"), "1->2", "2->3"));

        assertEquals(List.of("1", "2", "3"), ids(flow.mainFlow()));
    }

    @Test
    void shouldKeepSubStepVerticesOffMainFlow() {
        DiagramGraph plain = graph(List.of("1", "2", "3", "a", "b"), "1->2", "2->3", "2->a", "a->b");
        DiagramGraph graph = new DiagramGraph(plain.nodes(), plain.connections(), Map.of("a", "2", "b", "2"));

        FlowStructure flow = analyzer.analyze(graph);

        assertEquals(List.of("1", "2", "3"), ids(flow.mainFlow()));
        assertEquals(Map.of("2", List.of("a", "b")), branchIds(flow));
    }

    @Test
    void shouldHangSubStepUnderOwnerWithoutEdges() {
        DiagramGraph plain = graph(List.of("1", "2", "x"), "1->2");
        DiagramGraph graph = new DiagramGraph(plain.nodes(), plain.connections(), Map.of("x", "1"));

        FlowStructure flow = analyzer.analyze(graph);

        assertEquals(List.of("1", "2"), ids(flow.mainFlow()));
        assertEquals(Map.of("1", List.of("x")), branchIds(flow));
    }

    @Test
    void shouldIgnoreSubStepOwnerMissingFromGraph() {
        DiagramGraph plain = graph(List.of("1", "2"), "1->2");
        DiagramGraph graph = new DiagramGraph(plain.nodes(), plain.connections(), Map.of("2", "gone"));

        assertEquals(List.of("1", "2"), ids(analyzer.analyze(graph).mainFlow()));
    }

    @Test
    void shouldHandleVeryLongChain() {
        List<DiagramNode> nodes = new ArrayList<>();
        List<Connection> connections = new ArrayList<>();
        for (int i = 0; i < 20000; i++) {
            nodes.add(DiagramNode.of(String.valueOf(i), "Step " + i));
            if (i > 0) {
                connections.add(Connection.of(String.valueOf(i - 1), String.valueOf(i)));
            }
        }

        FlowStructure flow = analyzer.analyze(new DiagramGraph(nodes, connections));

        assertEquals(20000, flow.mainFlow().size());
        assertEquals("19999", flow.mainFlow().get(19999).id());
    }

    @Test
    void shouldAnchorEndOfLongSideChain() {
        List<DiagramNode> nodes = new ArrayList<>();
        List<Connection> connections = new ArrayList<>();
        for (int i = 0; i < 6000; i++) {
            nodes.add(DiagramNode.of("m" + i, "Main " + i));
            if (i > 0) {
                connections.add(Connection.of("m" + (i - 1), "m" + i));
            }
        }
        for (int i = 0; i < 3000; i++) {
            nodes.add(DiagramNode.of("s" + i, "Side " + i));
            connections.add(Connection.of(i == 0 ? "m1" : "s" + (i - 1), "s" + i));
        }

        FlowStructure flow = analyzer.analyze(new DiagramGraph(nodes, connections));

        assertEquals(6000, flow.mainFlow().size());
        assertEquals(3000, flow.branchesOf("m1").size());
        assertTrue(flow.orphans().isEmpty());
    }
}
