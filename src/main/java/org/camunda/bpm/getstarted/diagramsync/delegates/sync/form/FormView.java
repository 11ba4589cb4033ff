package org.camunda.bpm.getstarted.diagramsync.delegates.sync.form;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.Connection;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.DiagramNode;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.Subprocess;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * What the form shows for one diagram.
 *
 * @param diagramName        the page name of the diagram, if known
 * @param steps              the main flow, each step carrying its merged sub-step list
 * @param branchesByMainNode off-flow nodes keyed by the main-flow step they hang under
 * @param connections        every connection of the diagram
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FormView(
        String diagramName,
        List<DiagramNode> steps,
        Map<String, List<DiagramNode>> branchesByMainNode,
        List<Connection> connections
) {

    /**
     * Ids of every vertex this view lets the user remove: the steps, their sub-steps and the
     * off-flow nodes hung under them.
     */
    public Set<String> shownIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (DiagramNode step : steps) {
            if (step.id() != null) {
                ids.add(step.id());
            }
            for (Subprocess sub : step.subprocesses()) {
                if (sub.id() != null) {
                    ids.add(sub.id());
                }
                if (sub.branchId() != null) {
                    ids.add(sub.branchId());
                }
            }
        }
        if (branchesByMainNode != null) {
            branchesByMainNode.values().forEach(branches -> branches.stream()
                    .map(DiagramNode::id)
                    .filter(Objects::nonNull)
                    .forEach(ids::add));
        }
        return ids;
    }
}
