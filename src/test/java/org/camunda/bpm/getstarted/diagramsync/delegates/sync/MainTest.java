package org.camunda.bpm.getstarted.diagramsync.delegates.sync;

import org.camunda.bpm.getstarted.diagramsync.delegates.sync.codec.DiagramCodec;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.GraphExtractor;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.DiagramGraph;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {
    private static final String ONBOARDING_DRAWIO = "src/main/resources/models/onboarding.drawio";

    @TempDir
    Path tempDir;

    @Test
    void shouldRebuildGraphIntoOutputFile() throws Exception {
        Path graphJson = tempDir.resolve("graph.json");
        Files.writeString(graphJson, "{\"nodes\": [{\"id\": \"a\", \"label\": \"Plan\"}, {\"id\": \"b\", \"label\": \"Ship\"}],"
                + " \"connections\": [{\"from\": \"a\", \"to\": \"b\"}]}");
        Path out = tempDir.resolve("out/rebuilt.drawio");

        new Main(new String[]{"rebuild", graphJson.toString(), out.toString()}).run();

        DiagramGraph graph = GraphExtractor.extract(DiagramCodec.decode(Files.readString(out)).body());
        assertEquals(2, graph.nodes().size());
        assertEquals(1, graph.connections().size());
    }

    @Test
    void shouldSaveEditedNodesIntoOutputFile() throws Exception {
        Path nodesJson = tempDir.resolve("nodes.json");
        Files.writeString(nodesJson, "[{\"id\": \"2\", \"label\": \"Start\", \"shape\": \"ELLIPSE\"},"
                + " {\"id\": \"3\"}, {\"id\": \"4\"}, {\"id\": \"5\", \"label\": \"Finished\", \"shape\": \"ELLIPSE\"}]");
        Path out = tempDir.resolve("saved.drawio");

        new Main(new String[]{"save", ONBOARDING_DRAWIO, nodesJson.toString(), out.toString()}).run();

        String saved = Files.readString(out);
        assertTrue(saved.contains("Finished"));
        assertTrue(saved.startsWith("<mxfile"));
    }

    @Test
    void shouldRejectUnknownCommand() {
        assertThrows(IllegalArgumentException.class, () -> new Main(new String[]{"export"}));
    }

    @Test
    void shouldRequireNodesForSave() {
        assertThrows(IllegalArgumentException.class, () -> new Main(new String[]{"save", ONBOARDING_DRAWIO}));
    }
}
