package org.camunda.bpm.getstarted.diagramsync.delegates.sync.build;

import lombok.extern.slf4j.Slf4j;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.codec.DiagramCodec;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.config.models.LayoutConfig;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.config.models.SyncConfig;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.Connection;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.DiagramGraph;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.DiagramNode;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.ShapeKind;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.patch.DiagramDocument;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.patch.IdAllocator;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.patch.PatchEngine;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Writes a new diagram body from a node and connection list, discarding any existing XML.
 * <p>
 * Node ids are kept where they are unique; blank, duplicate or reserved ids get a fresh one.
 * Owners and sub-steps go through {@link PatchEngine}, so a rebuilt diagram lays out sub-steps
 * and their edges exactly as a patched one would.
 */
@Slf4j
public class DiagramBuilder {
    private static final String EMPTY_MODEL = "<mxGraphModel dx=\"1484\" dy=\"645\" grid=\"1\" gridSize=\"10\""
            + " guides=\"1\" tooltips=\"1\" connect=\"1\" arrows=\"1\" fold=\"1\" page=\"1\" pageScale=\"1\""
            + " pageWidth=\"827\" pageHeight=\"1169\" math=\"0\" shadow=\"0\">"
            + "<root><mxCell id=\"0\"/><mxCell id=\"%s\" parent=\"0\"/></root></mxGraphModel>";

    private final SyncConfig config;
    private final PatchEngine patchEngine;

    public DiagramBuilder() {
        this(SyncConfig.defaults());
    }

    public DiagramBuilder(SyncConfig config) {
        this.config = config;
        this.patchEngine = new PatchEngine(config);
    }

    /**
     * Builds a body holding the graph's nodes, the connections whose ends exist and the nodes'
     * sub-steps.
     *
     * @throws org.camunda.bpm.getstarted.diagramsync.delegates.sync.patch.IdentifierExhaustionException
     *         if no free id can be found
     */
    public String build(DiagramGraph graph) {
        LayoutConfig layout = config.layout;
        String layer = layout.defaultParent;
        DiagramDocument document = DiagramDocument.parse(String.format(EMPTY_MODEL, layer));

        Set<String> requested = new HashSet<>();
        graph.nodes().forEach(node -> {
            if (node.id() != null) {
                requested.add(node.id());
            }
        });
        requested.addAll(document.allIds());
        IdAllocator allocator = new IdAllocator(requested, config.ids);

        Set<String> written = new HashSet<>(document.allIds());
        List<DiagramNode> builtNodes = new ArrayList<>();
        for (int i = 0; i < graph.nodes().size(); i++) {
            DiagramNode node = graph.nodes().get(i);
            String id = node.id();
            if (id == null || id.isBlank() || written.contains(id)) {
                String fresh = allocator.nextSubprocessId();
                log.warn("Node id '{}' is blank, duplicate or reserved, using {}", id, fresh);
                id = fresh;
            }
            written.add(id);

            ShapeKind shape = node.shape();
            double width = layout.nodeWidth;
            double height = shape == ShapeKind.ELLIPSE ? layout.ellipseHeight : layout.nodeHeight;
            double x = node.x();
            double y = node.y();
            if (x == 0 && y == 0) {
                x = layout.originX + i * (width + layout.nodeSpacing);
                y = layout.originY;
            }
            String label = node.label() == null ? "" : node.label();
            document.addVertex(id, label, shape.canonicalStyle(), layer, x, y, width, height);
            builtNodes.add(node.toBuilder().id(id).build());
        }

        int edges = 0;
        for (Connection connection : graph.connections()) {
            if (document.findVertex(connection.from()) == null || document.findVertex(connection.to()) == null) {
                log.warn("Dropping connection {} -> {}: endpoint missing", connection.from(), connection.to());
                continue;
            }
            String style = connection.style() == null || connection.style().isBlank()
                    ? config.styles.defaultEdge
                    : connection.style();
            document.addEdge(allocator.nextEdgeId(), connection.from(), connection.to(), style, layer);
            edges++;
        }

        patchEngine.patch(document, builtNodes);
        log.info("Built diagram with {} nodes and {} connections", builtNodes.size(), edges);
        return document.write();
    }

    /**
     * Builds a standalone {@code <mxfile>} document.
     */
    public String buildDocument(DiagramGraph graph, String diagramName, boolean compress) {
        return DiagramCodec.wrap(build(graph), diagramName, null, compress);
    }
}
