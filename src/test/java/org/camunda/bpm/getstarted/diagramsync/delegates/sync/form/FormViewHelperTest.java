package org.camunda.bpm.getstarted.diagramsync.delegates.sync.form;

import org.camunda.bpm.getstarted.diagramsync.delegates.sync.codec.DiagramCodec;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.flow.FlowAnalyzer;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.flow.FlowStructure;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.GraphExtractor;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.DiagramGraph;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.DiagramNode;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.ShapeKind;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.Subprocess;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FormViewHelperTest {
    private static final String ONBOARDING_DRAWIO = "src/main/resources/models/onboarding.drawio";

    private DiagramGraph graph;
    private FlowStructure flow;

    @BeforeEach
    void loadDiagram() throws IOException {
        String body = DiagramCodec.decode(Files.readString(Path.of(ONBOARDING_DRAWIO))).body();
        graph = GraphExtractor.extract(body);
        flow = new FlowAnalyzer().analyze(graph);
    }

    private static Subprocess user(String name, String parent) {
        return Subprocess.builder().name(name).parent(parent).build();
    }

    private static List<String> names(List<Subprocess> subprocesses) {
        return subprocesses.stream().map(Subprocess::name).toList();
    }

    private static DiagramNode step(FormView view, String id) {
        return view.steps().stream().filter(node -> id.equals(node.id())).findFirst().orElseThrow();
    }

    @Test
    void shouldShowMainFlowWithDetectedSubprocesses() {
        FormView view = FormViewHelper.buildFormView("Onboarding", graph, flow, List.of(), new FormSession());

        assertEquals("Onboarding", view.diagramName());
        assertEquals(List.of("2", "3", "4", "5"), view.steps().stream().map(DiagramNode::id).toList());

        DiagramNode collect = step(view, "3");
        assertEquals("HR", collect.owner());
        assertEquals(1, collect.subprocesses().size());
        Subprocess laptop = collect.subprocesses().get(0);
        assertEquals("Order laptop", laptop.name());
        assertEquals(ShapeKind.DECISION, laptop.shape());
        assertEquals(Subprocess.MAIN_PARENT, laptop.parent());
        assertTrue(laptop.detected());
        assertEquals("6", laptop.branchId());
        assertEquals(4, view.connections().size());
    }

    @Test
    void shouldTakeOwnerFromPersistedNodeWhenDiagramHasNone() {
        DiagramNode persisted = DiagramNode.of("4", "Sign contract").toBuilder().owner("Legal").build();

        FormView view = FormViewHelper.buildFormView(graph, flow, List.of(persisted), new FormSession());

        assertEquals("Legal", step(view, "4").owner());
        assertEquals("HR", step(view, "3").owner());
    }

    @Test
    void shouldNotDuplicateDetectedSubprocessCoveredByUserEntry() {
        DiagramNode byName = DiagramNode.of("3", "Collect documents")
                .withSubprocesses(List.of(user("Order laptop", "main")));
        DiagramNode byBranch = DiagramNode.of("3", "Collect documents")
                .withSubprocesses(List.of(Subprocess.builder().name("Order a laptop").branchId("6").build()));

        List<Subprocess> mergedByName = step(FormViewHelper.buildFormView(graph, flow, List.of(byName), new FormSession()), "3").subprocesses();
        List<Subprocess> mergedByBranch = step(FormViewHelper.buildFormView(graph, flow, List.of(byBranch), new FormSession()), "3").subprocesses();

        assertEquals(List.of("Order laptop"), names(mergedByName));
        assertFalse(mergedByName.get(0).detected());
        assertEquals(List.of("Order a laptop"), names(mergedByBranch));
    }

    @Test
    void shouldListDetectedBeforeUserSubprocessesAndRemapParents() {
        DiagramNode persisted = DiagramNode.of("3", "Collect documents")
                .withSubprocesses(List.of(user("Book desk", "main"), user("Order chair", "subprocess-0")));

        FormView view = FormViewHelper.buildFormView(graph, flow, List.of(persisted), new FormSession());

        List<Subprocess> merged = step(view, "3").subprocesses();
        assertEquals(List.of("Order laptop", "Book desk", "Order chair"), names(merged));
        assertEquals("main", merged.get(1).parent());
        assertEquals("subprocess-1", merged.get(2).parent());
    }

    @Test
    void shouldKeepUserParentPointingAtDetectedEntry() {
        Subprocess detected = Subprocess.builder().name("Order laptop").detected(true).branchId("6").id("6").build();
        DiagramNode persisted = DiagramNode.of("3", "Collect documents")
                .withSubprocesses(List.of(detected, user("Install software", "subprocess-0")));

        List<Subprocess> merged = step(FormViewHelper.buildFormView(graph, flow, List.of(persisted), new FormSession()), "3")
                .subprocesses();

        assertEquals(List.of("Order laptop", "Install software"), names(merged));
        assertTrue(merged.get(0).detected());
        assertEquals("subprocess-0", merged.get(1).parent());
    }

    @Test
    void shouldHideDetectedSubprocessRemovedInSession() {
        FormSession session = new FormSession();
        FormView view = FormViewHelper.buildFormView(graph, flow, List.of(), session);

        DiagramNode edited = FormViewHelper.removeSubprocess(step(view, "3"), 0, session);
        FormView again = FormViewHelper.buildFormView(graph, flow, List.of(edited), session);

        assertTrue(edited.subprocesses().isEmpty());
        assertTrue(session.hasDeletions());
        assertTrue(step(again, "3").subprocesses().isEmpty());

        session.reload();
        FormView reloaded = FormViewHelper.buildFormView(graph, flow, List.of(edited), session);
        assertEquals(List.of("Order laptop"), names(step(reloaded, "3").subprocesses()));
    }

    @Test
    void shouldShiftPositionalParentsOnRemoval() {
        DiagramNode node = DiagramNode.of("4", "Sign contract").withSubprocesses(List.of(
                user("A", "main"), user("B", "subprocess-0"), user("C", "subprocess-1"), user("D", "subprocess-2")));

        DiagramNode withoutFirst = FormViewHelper.removeSubprocess(node, 0, null);
        DiagramNode withoutSecond = FormViewHelper.removeSubprocess(node, 1, null);

        assertEquals(List.of("B", "C", "D"), names(withoutFirst.subprocesses()));
        assertEquals(List.of("main", "subprocess-0", "subprocess-1"),
                withoutFirst.subprocesses().stream().map(Subprocess::parent).toList());
        assertEquals(List.of("A", "C", "D"), names(withoutSecond.subprocesses()));
        assertEquals(List.of("main", "main", "subprocess-1"),
                withoutSecond.subprocesses().stream().map(Subprocess::parent).toList());
    }

    @Test
    void shouldTurnEditedSubprocessIntoUserEntry() {
        FormView view = FormViewHelper.buildFormView(graph, flow, List.of(), new FormSession());

        DiagramNode edited = FormViewHelper.editSubprocess(step(view, "3"), 0,
                Subprocess.builder().name("Order laptop and phone").shape(ShapeKind.RECTANGLE).build());

        Subprocess sub = edited.subprocesses().get(0);
        assertEquals("Order laptop and phone", sub.name());
        assertFalse(sub.detected());
        assertEquals("6", sub.branchId());
        assertEquals("6", sub.id());
    }

    @Test
    void shouldAppendAddedSubprocessAsUserEntry() {
        DiagramNode node = DiagramNode.of("5", "Done");

        DiagramNode added = FormViewHelper.addSubprocess(node,
                Subprocess.builder().name("Send welcome mail").detected(true).build());

        assertEquals(1, added.subprocesses().size());
        assertFalse(added.subprocesses().get(0).detected());
        assertTrue(node.subprocesses().isEmpty());
    }

    @Test
    void shouldRejectUnknownSubprocessIndex() {
        DiagramNode node = DiagramNode.of("5", "Done");

        assertThrows(IllegalArgumentException.class, () -> FormViewHelper.removeSubprocess(node, 0, new FormSession()));
        assertThrows(IllegalArgumentException.class, () -> FormViewHelper.editSubprocess(node, -1, Subprocess.named("x")));
    }
}
