package org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Nodes and connections extracted from one diagram body.
 *
 * @param subStepOwners ids of sub-step vertices mapped to the id of the step they belong to
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DiagramGraph(
        List<DiagramNode> nodes,
        List<Connection> connections,
        Map<String, String> subStepOwners
) {
    public DiagramGraph {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        connections = connections == null ? List.of() : List.copyOf(connections);
        subStepOwners = subStepOwners == null ? Map.of() : Map.copyOf(subStepOwners);
    }

    public DiagramGraph(List<DiagramNode> nodes, List<Connection> connections) {
        this(nodes, connections, Map.of());
    }

    public static DiagramGraph empty() {
        return new DiagramGraph(List.of(), List.of());
    }

    /**
     * Adds the user-authored sub-steps of {@code steps} that already have a vertex to
     * {@link #subStepOwners()}. Owners read from the diagram win.
     */
    public DiagramGraph withSubStepsOf(List<DiagramNode> steps) {
        if (steps == null || steps.isEmpty()) {
            return this;
        }
        Map<String, String> owners = new LinkedHashMap<>();
        for (DiagramNode step : steps) {
            for (Subprocess sub : step.subprocesses()) {
                if (step.id() != null && !sub.detected() && sub.id() != null && !sub.id().equals(step.id())) {
                    owners.putIfAbsent(sub.id(), step.id());
                }
            }
        }
        owners.putAll(subStepOwners);
        return new DiagramGraph(nodes, connections, owners);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return nodes.isEmpty() && connections.isEmpty();
    }
}
