package org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models;

public enum CellKind {
    VERTEX,
    EDGE
}
