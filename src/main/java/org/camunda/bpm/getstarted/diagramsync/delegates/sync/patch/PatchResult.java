package org.camunda.bpm.getstarted.diagramsync.delegates.sync.patch;

import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.DiagramNode;

import java.util.List;

/**
 * Outcome of one patch run.
 *
 * @param body    the patched body, or the original body when nothing was applied
 * @param nodes   the target nodes with the ids of created sub-step vertices filled in
 * @param applied false when the patch was discarded and the original body returned
 * @param changed whether {@code body} differs from the original body
 */
public record PatchResult(
        String body,
        List<DiagramNode> nodes,
        boolean applied,
        boolean changed
) {
    public PatchResult {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
    }

    public static PatchResult unchanged(String originalBody, List<DiagramNode> nodes) {
        return new PatchResult(originalBody, nodes, false, false);
    }
}
