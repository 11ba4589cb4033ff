package org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models;

import lombok.Builder;

/**
 * A vertex or edge of the interchange graph, with the effective id and label already resolved
 * for cells nested in a {@code UserObject} wrapper.
 *
 * @param id      the effective document-unique id
 * @param kind    vertex or edge
 * @param style   the raw style string
 * @param label   the raw label (may contain HTML)
 * @param parent  the id of the containing cell, usually the default layer {@code "1"}
 * @param source  edge source id, null for vertices
 * @param target  edge target id, null for vertices
 * @param owner   step owner stored as a wrapper property
 * @param wrapped whether the cell sits inside a {@code UserObject}/{@code object} wrapper
 */
@Builder(toBuilder = true)
public record Cell(
        String id,
        CellKind kind,
        String style,
        String label,
        double x,
        double y,
        double width,
        double height,
        String parent,
        String source,
        String target,
        String owner,
        boolean wrapped
) {
    public boolean isVertex() {
        return kind == CellKind.VERTEX;
    }

    public boolean isEdge() {
        return kind == CellKind.EDGE;
    }
}
