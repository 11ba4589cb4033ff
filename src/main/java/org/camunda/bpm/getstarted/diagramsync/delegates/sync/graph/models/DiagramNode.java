package org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.ArrayList;
import java.util.List;

/**
 * A vertex promoted to a process step.
 */
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DiagramNode(
        String id,
        String label,
        ShapeKind shape,
        double x,
        double y,
        double width,
        double height,
        String owner,
        List<Subprocess> subprocesses
) {
    public DiagramNode {
        if (shape == null) {
            shape = ShapeKind.RECTANGLE;
        }
        subprocesses = subprocesses == null ? List.of() : List.copyOf(subprocesses);
    }

    public static DiagramNode of(String id, String label) {
        return new DiagramNode(id, label, ShapeKind.RECTANGLE, 0, 0, 0, 0, null, List.of());
    }

    public DiagramNode withSubprocesses(List<Subprocess> newSubprocesses) {
        return toBuilder().subprocesses(new ArrayList<>(newSubprocesses)).build();
    }
}
