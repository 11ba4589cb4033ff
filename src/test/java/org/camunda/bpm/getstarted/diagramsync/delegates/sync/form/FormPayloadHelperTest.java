package org.camunda.bpm.getstarted.diagramsync.delegates.sync.form;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.DiagramGraph;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.DiagramNode;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.ShapeKind;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.Subprocess;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FormPayloadHelperTest {
    private static final ObjectMapper mapper = new ObjectMapper();

    @Test
    void shouldReadEditedNodes() {
        String json = """
                [
                  {"id": "3", "label": "Collect documents", "owner": "HR", "shape": "ellipse",
                   "subprocesses": [
                     {"name": "Order laptop", "isDetected": true, "branchId": "6", "id": "6", "shape": "decision"},
                     {"name": "Book desk", "parent": "subprocess-0"}
                   ]},
                  {"id": 4, "label": "Sign contract", "unknownField": 1}
                ]
                """;

        List<DiagramNode> nodes = FormPayloadHelper.readNodes(json);

        assertEquals(2, nodes.size());
        DiagramNode collect = nodes.get(0);
        assertEquals(ShapeKind.ELLIPSE, collect.shape());
        assertEquals("HR", collect.owner());
        Subprocess laptop = collect.subprocesses().get(0);
        assertTrue(laptop.detected());
        assertEquals(ShapeKind.DECISION, laptop.shape());
        assertEquals("main", laptop.parent());
        assertEquals("subprocess-0", collect.subprocesses().get(1).parent());
        assertFalse(collect.subprocesses().get(1).detected());

        DiagramNode sign = nodes.get(1);
        assertEquals("4", sign.id());
        assertEquals(ShapeKind.RECTANGLE, sign.shape());
        assertTrue(sign.subprocesses().isEmpty());
    }

    @Test
    void shouldTreatBlankPayloadAsNoNodes() {
        assertTrue(FormPayloadHelper.readNodes(null).isEmpty());
        assertTrue(FormPayloadHelper.readNodes("  ").isEmpty());
        assertTrue(FormPayloadHelper.readNodes("[]").isEmpty());
    }

    @Test
    void shouldRejectPayloadsThatDoNotMatchSchema() {
        assertThrows(InvalidFormPayloadException.class, () -> FormPayloadHelper.readNodes("{\"id\": \"1\"}"));
        assertThrows(InvalidFormPayloadException.class, () -> FormPayloadHelper.readNodes("[{\"label\": \"no id\"}]"));
        assertThrows(InvalidFormPayloadException.class,
                () -> FormPayloadHelper.readNodes("[{\"id\": \"1\", \"subprocesses\": [{\"parent\": \"sibling-2\"}]}]"));
        assertThrows(InvalidFormPayloadException.class, () -> FormPayloadHelper.readNodes("[{\"id\": "));
    }

    @Test
    void shouldReportSchemaViolations() throws Exception {
        JsonNode payload = mapper.readTree("[{\"id\": true}]");

        assertFalse(FormPayloadHelper.validate(payload).isEmpty());
        assertTrue(FormPayloadHelper.validate(mapper.readTree("[{\"id\": \"1\"}]")).isEmpty());
    }

    @Test
    void shouldWriteNodesThatReadBack() throws Exception {
        DiagramNode node = DiagramNode.of("3", "Collect documents")
                .withSubprocesses(List.of(Subprocess.builder().name("Order laptop").detected(true).branchId("6").build()));

        String json = FormPayloadHelper.writeNodes(List.of(node));

        JsonNode written = mapper.readTree(json);
        assertEquals("rectangle", written.get(0).get("shape").asText());
        assertTrue(written.get(0).get("subprocesses").get(0).get("isDetected").asBoolean());
        assertFalse(written.get(0).has("owner"));
        assertEquals(List.of(node), FormPayloadHelper.readNodes(json));
    }

    @Test
    void shouldWriteFormView() throws Exception {
        DiagramNode node = DiagramNode.of("2", "Start");
        FormView view = new FormView("Onboarding", List.of(node), Map.of("2", List.of(DiagramNode.of("9", "Side"))), List.of());

        JsonNode written = mapper.readTree(FormPayloadHelper.writeFormView(view));

        assertEquals("Onboarding", written.get("diagramName").asText());
        assertEquals("2", written.get("steps").get(0).get("id").asText());
        assertEquals("9", written.get("branchesByMainNode").get("2").get(0).get("id").asText());
    }

    @Test
    void shouldReadGraphForRebuild() {
        String json = """
                {"nodes": [{"id": "a", "label": "A"}, {"id": "b", "label": "B", "shape": "document"}],
                 "connections": [{"from": "a", "to": "b", "dashed": true}]}
                """;

        DiagramGraph graph = FormPayloadHelper.readGraph(json);

        assertEquals(2, graph.nodes().size());
        assertEquals(ShapeKind.DOCUMENT, graph.nodes().get(1).shape());
        assertEquals(1, graph.connections().size());
        assertEquals(Boolean.TRUE, graph.connections().get(0).dashed());
    }

    @Test
    void shouldRejectGraphThatIsNotAnObject() {
        assertThrows(InvalidFormPayloadException.class, () -> FormPayloadHelper.readGraph("[]"));
        assertThrows(InvalidFormPayloadException.class, () -> FormPayloadHelper.readGraph("{\"nodes\": [{}]}"));
    }

    @Test
    void shouldReadShownIdsFromWrittenFormView() {
        DiagramNode collect = DiagramNode.of("3", "Collect documents").withSubprocesses(List.of(
                Subprocess.builder().name("Order laptop").detected(true).branchId("6").id("6").build(),
                Subprocess.builder().name("Book desk").id("10000").build()));
        FormView view = new FormView("Onboarding", List.of(DiagramNode.of("2", "Start"), collect),
                Map.of("3", List.of(DiagramNode.of("6", "Order laptop"), DiagramNode.of("9", "Hidden"))), List.of());

        Set<String> ids = FormPayloadHelper.readShownIds(FormPayloadHelper.writeFormView(view));

        assertEquals(Set.of("2", "3", "6", "9", "10000"), ids);
    }

    @Test
    void shouldRejectFormViewWithoutSteps() {
        assertThrows(InvalidFormPayloadException.class, () -> FormPayloadHelper.readShownIds("{}"));
        assertThrows(InvalidFormPayloadException.class, () -> FormPayloadHelper.readShownIds("not json"));
    }
}
