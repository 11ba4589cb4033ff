package org.camunda.bpm.getstarted.diagramsync.delegates.sync.patch;

import lombok.extern.slf4j.Slf4j;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.config.models.SyncConfig;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.flow.FlowAnalyzer;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.flow.FlowStructure;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.LabelHelper;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.MalformedDocumentException;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.ResolvedCell;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.StyleHelper;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.Cell;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.DiagramNode;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.ShapeKind;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.Subprocess;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Applies the form's node list to a diagram body.
 * <p>
 * The body is parsed once, edited in place and written once, so every cell the form does not
 * touch keeps its attributes, geometry and position in the document. The result is checked by
 * {@link PatchValidator}; a patch that fails the check is discarded and the original body kept.
 */
@Slf4j
public class PatchEngine {
    private final SyncConfig config;
    private final FlowAnalyzer flowAnalyzer;

    public PatchEngine() {
        this(SyncConfig.defaults());
    }

    public PatchEngine(SyncConfig config) {
        this.config = config;
        this.flowAnalyzer = new FlowAnalyzer(config.flow);
    }

    /**
     * Patches {@code originalBody} so that it shows {@code targetNodes}, treating the body as the
     * one the form was loaded from.
     *
     * @param originalBody the decompressed body to patch
     * @param targetNodes  the steps as edited in the form
     * @return the patched body and the nodes with the ids of created vertices
     */
    public PatchResult apply(String originalBody, List<DiagramNode> targetNodes) {
        return apply(originalBody, targetNodes, null);
    }

    /**
     * Patches {@code originalBody} so that it shows {@code targetNodes}.
     *
     * @param shownIds ids of the steps and sub-steps the form was shown when it was loaded. Only
     *                 these vertices are deleted when the form no longer lists them, so vertices
     *                 added to the body since then are kept. {@code null} means the body is the
     *                 one the form was loaded from.
     */
    public PatchResult apply(String originalBody, List<DiagramNode> targetNodes, Set<String> shownIds) {
        if (targetNodes == null || targetNodes.isEmpty()) {
            log.info("No target nodes, keeping the diagram as it is");
            return PatchResult.unchanged(originalBody, List.of());
        }

        DiagramDocument document;
        try {
            document = DiagramDocument.parse(originalBody);
        } catch (MalformedDocumentException e) {
            log.error("Cannot patch diagram: {}", e.getMessage());
            return PatchResult.unchanged(originalBody, targetNodes);
        }

        try {
            List<DiagramNode> patchedNodes = patch(document, targetNodes, shownIds);
            if (!document.isModified()) {
                log.info("Diagram already matches the form, nothing to patch");
                return new PatchResult(originalBody, patchedNodes, true, false);
            }

            String body = keepOuterWhitespace(originalBody, document.write());
            PatchValidator.validate(originalBody, body);
            log.info("Patched diagram for {} steps", targetNodes.size());
            return new PatchResult(body, patchedNodes, true, !body.equals(originalBody));
        } catch (StructuralValidationException | IdentifierExhaustionException e) {
            log.error("Discarding patch, keeping the original diagram: {}", e.getMessage());
            return PatchResult.unchanged(originalBody, targetNodes);
        }
    }

    /**
     * Applies target nodes to an already parsed document without validating or writing it.
     * Allocation failures propagate to the caller.
     */
    public List<DiagramNode> patch(DiagramDocument document, List<DiagramNode> targetNodes) {
        return patch(document, targetNodes, null);
    }

    public List<DiagramNode> patch(DiagramDocument document, List<DiagramNode> targetNodes, Set<String> shownIds) {
        FlowStructure flow = flowAnalyzer.analyze(document.toGraph().withSubStepsOf(targetNodes));
        IdAllocator allocator = new IdAllocator(document.allIds(), config.ids);

        removeForgottenVertices(document, flow, targetNodes, shownIds);

        List<DiagramNode> result = new ArrayList<>();
        for (DiagramNode node : targetNodes) {
            result.add(patchNode(document, allocator, node));
        }
        return result;
    }

    /**
     * Deletes the vertices the form was shown (main flow and detected branches) but no longer lists.
     */
    private void removeForgottenVertices(DiagramDocument document, FlowStructure flow, List<DiagramNode> targetNodes,
                                         Set<String> shownIds) {
        Set<String> known = new LinkedHashSet<>();
        flow.mainFlow().forEach(node -> known.add(node.id()));
        flow.branchesByMainNode().values().forEach(branches -> branches.forEach(node -> known.add(node.id())));

        Set<String> referenced = new HashSet<>();
        for (DiagramNode node : targetNodes) {
            referenced.add(node.id());
            for (Subprocess sub : node.subprocesses()) {
                if (sub.id() != null) {
                    referenced.add(sub.id());
                }
                if (sub.branchId() != null) {
                    referenced.add(sub.branchId());
                }
            }
        }

        for (String id : known) {
            if (referenced.contains(id)) {
                continue;
            }
            if (shownIds != null && !shownIds.contains(id)) {
                log.info("Keeping vertex {}: added after the form was loaded", id);
                continue;
            }
            if (document.findVertex(id) != null) {
                Set<String> removed = document.removeVertex(id);
                log.info("Removed vertex {} and {} dependent cells", id, removed.size() - 1);
            }
        }
    }

    private DiagramNode patchNode(DiagramDocument document, IdAllocator allocator, DiagramNode node) {
        ResolvedCell cell = document.findVertex(node.id());
        if (cell == null) {
            log.warn("Step {} ('{}') is not in the diagram, skipping it", node.id(), node.label());
            return node;
        }

        if (node.label() != null) {
            document.updateLabel(cell, node.label());
        }
        cell = document.updateOwner(cell, node.owner());
        updateShape(document, cell, node.shape());

        List<Subprocess> subprocesses = node.subprocesses();
        if (subprocesses.isEmpty()) {
            return node;
        }

        String layer = cell.cell().parent() != null ? cell.cell().parent() : config.layout.defaultParent;
        List<Subprocess> patchedSubs = new ArrayList<>();
        List<String> vertexIds = new ArrayList<>();
        for (int i = 0; i < subprocesses.size(); i++) {
            Subprocess sub = subprocesses.get(i);
            ResolvedCell subCell = findSubprocessVertex(document, sub);
            if (subCell != null) {
                if (!sub.detected()) {
                    if (sub.hasName()) {
                        document.updateLabel(subCell, sub.name());
                    }
                    updateShape(document, subCell, sub.shape());
                    markSubStep(document, subCell, node.id());
                }
                if (sub.id() == null || !sub.id().equals(subCell.cell().id())) {
                    sub = sub.toBuilder().id(subCell.cell().id()).build();
                }
            } else if (sub.hasName() && !sub.detected()) {
                subCell = createSubprocessVertex(document, allocator, cell.cell(), layer, sub, i);
                sub = sub.toBuilder().id(subCell.cell().id()).build();
            } else {
                log.debug("Sub-step {} of {} has no vertex and nothing to create", i, node.id());
            }
            vertexIds.add(subCell != null ? subCell.cell().id() : null);
            patchedSubs.add(sub);
        }

        reconcileEdges(document, allocator, node.id(), layer, patchedSubs, vertexIds);
        return node.withSubprocesses(patchedSubs);
    }

    private static ResolvedCell findSubprocessVertex(DiagramDocument document, Subprocess sub) {
        ResolvedCell byId = document.findVertex(sub.id());
        return byId != null ? byId : document.findVertex(sub.branchId());
    }

    private ResolvedCell createSubprocessVertex(DiagramDocument document, IdAllocator allocator, Cell owner,
                                                String layer, Subprocess sub, int index) {
        String id = allocator.nextSubprocessId();
        double width = config.layout.nodeWidth;
        double x = owner.x() + (owner.width() > 0 ? owner.width() : width) + config.layout.subprocessGap;
        double y = owner.y() + index * config.layout.subprocessSpacing;
        String style = StyleHelper.withSubStepOwner(sub.shape().canonicalStyle(), owner.id());
        String label = LabelHelper.toStoredLabel(sub.name().trim(), StyleHelper.isHtml(style));
        log.info("Adding sub-step vertex {} ('{}') next to {}", id, sub.name(), owner.id());
        return document.addVertex(id, label, style, layer, x, y, width, config.layout.nodeHeight);
    }

    /**
     * Makes the edges between a step's family (the step and its sub-step vertices) and its
     * user-authored sub-steps match the positional parents. Detected sub-steps keep their edges.
     */
    private void reconcileEdges(DiagramDocument document, IdAllocator allocator, String nodeId, String layer,
                                List<Subprocess> subprocesses, List<String> vertexIds) {
        int[] parents = SubprocessParentResolver.resolve(subprocesses);

        Set<String> family = new HashSet<>();
        family.add(nodeId);
        Set<String> userVertices = new HashSet<>();
        for (int i = 0; i < subprocesses.size(); i++) {
            String vertexId = vertexIds.get(i);
            if (vertexId == null) {
                continue;
            }
            family.add(vertexId);
            if (!subprocesses.get(i).detected()) {
                userVertices.add(vertexId);
            }
        }

        Set<String> desired = new LinkedHashSet<>();
        for (int i = 0; i < subprocesses.size(); i++) {
            String vertexId = vertexIds.get(i);
            if (vertexId == null || subprocesses.get(i).detected()) {
                continue;
            }
            String source = parents[i] == SubprocessParentResolver.MAIN ? null : vertexIds.get(parents[i]);
            desired.add(edgeKey(source != null ? source : nodeId, vertexId));
        }

        Set<String> present = new HashSet<>();
        for (ResolvedCell edge : document.edges()) {
            Cell cell = edge.cell();
            if (cell.source() == null || cell.target() == null) {
                continue;
            }
            boolean incoming = userVertices.contains(cell.target()) && family.contains(cell.source());
            boolean backToStep = userVertices.contains(cell.source()) && nodeId.equals(cell.target());
            if (!incoming && !backToStep) {
                continue;
            }
            String key = edgeKey(cell.source(), cell.target());
            if (desired.contains(key) && present.add(key)) {
                continue;
            }
            log.info("Removing stale edge {} ({} -> {})", cell.id(), cell.source(), cell.target());
            document.removeEdge(edge);
        }

        for (String key : desired) {
            if (present.contains(key)) {
                continue;
            }
            String[] ends = key.split("\n", 2);
            String edgeId = allocator.nextEdgeId();
            log.info("Adding edge {} ({} -> {})", edgeId, ends[0], ends[1]);
            document.addEdge(edgeId, ends[0], ends[1], config.styles.subprocessEdge, layer);
        }
    }

    private static void markSubStep(DiagramDocument document, ResolvedCell cell, String ownerId) {
        String style = document.currentStyle(cell);
        if (!ownerId.equals(StyleHelper.subStepOwner(style))) {
            document.updateStyle(cell, StyleHelper.withSubStepOwner(style, ownerId));
        }
    }

    private static void updateShape(DiagramDocument document, ResolvedCell cell, ShapeKind shape) {
        String style = document.currentStyle(cell);
        if (shape == null || StyleHelper.inferShape(style) == shape) {
            return;
        }
        document.updateStyle(cell, StyleHelper.withShape(style, shape));
    }

    private static String edgeKey(String source, String target) {
        return source + "\n" + target;
    }

    private static String keepOuterWhitespace(String original, String written) {
        int start = 0;
        while (start < original.length() && Character.isWhitespace(original.charAt(start))) {
            start++;
        }
        int end = original.length();
        while (end > start && Character.isWhitespace(original.charAt(end - 1))) {
            end--;
        }
        return original.substring(0, start) + written + original.substring(end);
    }
}
