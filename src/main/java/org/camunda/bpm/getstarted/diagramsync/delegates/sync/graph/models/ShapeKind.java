package org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Closed set of shapes a process step can take.
 * <p>
 * Each kind owns the style tokens that identify it in a cell style and the canonical style
 * written when a vertex of that kind is created.
 */
public enum ShapeKind {
    RECTANGLE("rectangle", List.of("rect", "rectangle", "rounded"),
            "rounded=0;whiteSpace=wrap;html=1;"),
    ELLIPSE("ellipse", List.of("ellipse", "circle", "doubleEllipse"),
            "ellipse;whiteSpace=wrap;html=1;aspect=fixed;"),
    DECISION("decision", List.of("rhombus", "diamond"),
            "rhombus;whiteSpace=wrap;html=1;"),
    DATA("data", List.of("parallelogram"),
            "shape=parallelogram;perimeter=parallelogramPerimeter;whiteSpace=wrap;html=1;fixedSize=1;"),
    DOCUMENT("document", List.of("document"),
            "shape=document;whiteSpace=wrap;html=1;"),
    SUBPROCESS("subprocess", List.of("swimlane", "process", "subprocess"),
            "swimlane;whiteSpace=wrap;html=1;");

    private static final Map<String, ShapeKind> BY_TOKEN = buildTokenTable();

    private final String label;
    private final List<String> styleTokens;
    private final String canonicalStyle;

    ShapeKind(String label, List<String> styleTokens, String canonicalStyle) {
        this.label = label;
        this.styleTokens = styleTokens;
        this.canonicalStyle = canonicalStyle;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public List<String> styleTokens() {
        return styleTokens;
    }

    public String canonicalStyle() {
        return canonicalStyle;
    }

    /**
     * Looks up the kind owning a single style token. Returns null for tokens outside the table.
     */
    public static ShapeKind forToken(String token) {
        if (token == null) {
            return null;
        }
        return BY_TOKEN.get(token.trim().toLowerCase());
    }

    public static boolean isShapeToken(String token) {
        return forToken(token) != null;
    }

    @JsonCreator
    public static ShapeKind fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return RECTANGLE;
        }
        for (ShapeKind kind : values()) {
            if (kind.label.equalsIgnoreCase(label.trim())) {
                return kind;
            }
        }
        return RECTANGLE;
    }

    private static Map<String, ShapeKind> buildTokenTable() {
        Map<String, ShapeKind> table = new HashMap<>();
        for (ShapeKind kind : values()) {
            for (String token : kind.styleTokens) {
                table.put(token.toLowerCase(), kind);
            }
        }
        return Map.copyOf(table);
    }
}
