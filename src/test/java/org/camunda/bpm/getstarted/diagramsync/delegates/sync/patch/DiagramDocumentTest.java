package org.camunda.bpm.getstarted.diagramsync.delegates.sync.patch;

import org.camunda.bpm.getstarted.diagramsync.delegates.sync.codec.DiagramCodec;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.GraphExtractor;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.ResolvedCell;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.DiagramGraph;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.DiagramNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DiagramDocumentTest {
    private static final String ONBOARDING_DRAWIO = "src/main/resources/models/onboarding.drawio";

    private DiagramDocument document;

    @BeforeEach
    void parseDiagram() throws IOException {
        String body = DiagramCodec.decode(Files.readString(Path.of(ONBOARDING_DRAWIO))).body();
        document = DiagramDocument.parse(body);
    }

    @Test
    void shouldCollectEveryIdInTheDocument() {
        assertEquals(Set.of("0", "1", "2", "3", "4", "5", "6", "e1", "e2", "e3", "e4", "e4-label"), document.allIds());
        assertFalse(document.isModified());
    }

    @Test
    void shouldUpdateWrapperLabelAndSkipSameText() {
        ResolvedCell collect = document.findVertex("3");

        assertFalse(document.updateLabel(collect, "  Collect documents "));
        assertTrue(document.updateLabel(collect, "Collect papers"));

        assertEquals("<div><p>Collect papers</p></div>", document.currentLabel(collect));
        assertTrue(document.isModified());
    }

    @Test
    void shouldWrapPlainCellWhenOwnerIsSet() {
        ResolvedCell sign = document.findVertex("4");

        ResolvedCell wrapped = document.updateOwner(sign, "Legal");

        assertNotNull(wrapped.wrapperElement());
        assertEquals("Legal", document.currentOwner(wrapped));
        DiagramNode node = GraphExtractor.extract(document.write()).nodes().stream()
                .filter(candidate -> "4".equals(candidate.id()))
                .findFirst()
                .orElseThrow();
        assertEquals("Legal", node.owner());
        assertEquals("Sign <b>contract</b>", node.label());
        assertEquals(400.0, node.x());
    }

    @Test
    void shouldRemoveOwnerWhenBlank() {
        ResolvedCell collect = document.findVertex("3");

        document.updateOwner(collect, " ");

        assertNull(GraphExtractor.extract(document.write()).nodes().get(1).owner());
    }

    @Test
    void shouldCascadeVertexRemovalToEdgesAndChildren() {
        Set<String> removed = document.removeVertex("6");

        assertEquals(Set.of("6", "e4", "e4-label"), removed);
        DiagramGraph graph = GraphExtractor.extract(document.write());
        assertEquals(List.of("2", "3", "4", "5"), graph.nodes().stream().map(DiagramNode::id).toList());
        assertEquals(3, graph.connections().size());
        assertNull(document.find("e4"));
    }

    @Test
    void shouldAppendVertexAndEdge() {
        document.addVertex("100", "New", "rounded=0;html=1;", "1", 10.5, 20, 120, 60);
        document.addEdge("200", "5", "100", "endArrow=block;", "1");

        DiagramGraph graph = GraphExtractor.extract(document.write());
        DiagramNode added = graph.nodes().get(graph.nodes().size() - 1);
        assertEquals("100", added.id());
        assertEquals(10.5, added.x());
        assertTrue(graph.connections().stream().anyMatch(c -> "5".equals(c.from()) && "100".equals(c.to())));
        assertEquals(1, document.edges().stream().filter(edge -> "200".equals(edge.cell().id())).count());
    }

    @Test
    void shouldFormatWholeNumbersWithoutFraction() {
        assertEquals("40", DiagramDocument.formatNumber(40.0));
        assertEquals("12.5", DiagramDocument.formatNumber(12.5));
    }
}
