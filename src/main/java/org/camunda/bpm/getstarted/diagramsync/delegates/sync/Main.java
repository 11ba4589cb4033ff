package org.camunda.bpm.getstarted.diagramsync.delegates.sync;

import lombok.extern.slf4j.Slf4j;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.form.FormPayloadHelper;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.form.FormSession;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.form.FormView;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.DiagramGraph;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.DiagramNode;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.repository.InMemoryDiagramRepository;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Command line entry point.
 * <pre>
 *   load    &lt;diagram&gt; [nodes.json]         prints the form view
 *   save    &lt;diagram&gt; &lt;nodes.json&gt; [out]   patches the diagram with edited nodes
 *   rebuild &lt;graph.json&gt; [out]            writes a new diagram from a node list
 * </pre>
 * Without {@code out} the result is printed.
 */
@Slf4j
public class Main {
    // ------ Defaults when no arguments are given
    private String command = "load";
    private String diagramPath = "src/main/resources/models/onboarding.drawio";
    private String nodesPath = null;
    private String outputPath = null;

    private final DiagramSyncService syncService = new DiagramSyncService(new InMemoryDiagramRepository());

    public Main() {
    }

    Main(String[] args) {
        if (args.length == 0) {
            return;
        }
        command = args[0];
        switch (command) {
            case "load" -> {
                diagramPath = argument(args, 1, "diagram");
                nodesPath = args.length > 2 ? args[2] : null;
            }
            case "save" -> {
                diagramPath = argument(args, 1, "diagram");
                nodesPath = argument(args, 2, "nodes.json");
                outputPath = args.length > 3 ? args[3] : null;
            }
            case "rebuild" -> {
                nodesPath = argument(args, 1, "graph.json");
                outputPath = args.length > 2 ? args[2] : null;
            }
            default -> throw new IllegalArgumentException("Unknown command '" + command + "', expected load, save or rebuild");
        }
    }

    public void run() throws Exception {
        switch (command) {
            case "load" -> load();
            case "save" -> save();
            case "rebuild" -> rebuild();
            default -> throw new IllegalStateException("Unknown command '" + command + "'");
        }
    }

    private void load() throws Exception {
        List<DiagramNode> persisted = nodesPath == null ? List.of() : FormPayloadHelper.readNodes(read(nodesPath));
        FormView view = syncService.load(read(diagramPath), persisted, new FormSession());
        output(FormPayloadHelper.writeFormView(view));
    }

    private void save() throws Exception {
        List<DiagramNode> edited = FormPayloadHelper.readNodes(read(nodesPath));
        SaveResult result = syncService.save(read(diagramPath), edited);
        if (!result.patch().applied()) {
            log.warn("Edits were not applied, writing the diagram unchanged");
        }
        output(result.document());
    }

    private void rebuild() throws Exception {
        DiagramGraph graph = FormPayloadHelper.readGraph(read(nodesPath));
        output(syncService.rebuild(graph, "Page-1", false));
    }

    private void output(String content) throws Exception {
        if (outputPath == null) {
            System.out.println(content);
            return;
        }
        Path target = Path.of(outputPath);
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        Files.writeString(target, content, StandardCharsets.UTF_8);
        log.info("Wrote {}", target);
    }

    private static String read(String path) throws Exception {
        return Files.readString(Path.of(path), StandardCharsets.UTF_8);
    }

    private static String argument(String[] args, int index, String name) {
        if (args.length <= index) {
            throw new IllegalArgumentException("Missing argument <" + name + "> for '" + args[0] + "'");
        }
        return args[index];
    }

    public static void main(String[] args) throws Exception {
        Main main = new Main(args);
        main.run();
    }
}
