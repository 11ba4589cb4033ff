package org.camunda.bpm.getstarted.diagramsync.delegates.sync.flow;

import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.DiagramNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The display structure derived from a graph.
 *
 * @param mainFlow           the canonical ordered steps
 * @param branchesByMainNode off-flow nodes keyed by the id of the main-flow node they hang under,
 *                           in main-flow order
 * @param orphans            off-flow nodes with no path to or from the main flow
 */
public record FlowStructure(
        List<DiagramNode> mainFlow,
        Map<String, List<DiagramNode>> branchesByMainNode,
        List<DiagramNode> orphans
) {
    public FlowStructure {
        mainFlow = List.copyOf(mainFlow);
        Map<String, List<DiagramNode>> branches = new LinkedHashMap<>();
        branchesByMainNode.forEach((anchor, nodes) -> branches.put(anchor, List.copyOf(nodes)));
        branchesByMainNode = Collections.unmodifiableMap(branches);
        orphans = List.copyOf(orphans);
    }

    public static FlowStructure empty() {
        return new FlowStructure(List.of(), Map.of(), List.of());
    }

    public List<DiagramNode> branchesOf(String mainNodeId) {
        return branchesByMainNode.getOrDefault(mainNodeId, List.of());
    }

    public boolean isOnMainFlow(String nodeId) {
        return mainFlow.stream().anyMatch(node -> node.id().equals(nodeId));
    }
}
