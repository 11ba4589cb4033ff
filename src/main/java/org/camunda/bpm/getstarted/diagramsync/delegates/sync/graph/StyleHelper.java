package org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph;

import lombok.extern.slf4j.Slf4j;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.ShapeKind;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and rewrites draw.io style strings ({@code "ellipse;whiteSpace=wrap;html=1;"}).
 * <p>
 * A style is a {@code ;}-separated list of tokens. Tokens without {@code =} name a base style
 * (for example {@code ellipse} or {@code swimlane}); the others are key/value pairs.
 */
@Slf4j
public class StyleHelper {
    /**
     * Style key naming the step a generated sub-step vertex belongs to. Such vertices hang under
     * that step and never take part in the main flow.
     */
    public static final String SUB_STEP_OF = "subStepOf";

    private static final String FLAG = "";

    /**
     * Parses a style into an ordered map. Bare tokens map to an empty string.
     */
    public static Map<String, String> parse(String style) {
        Map<String, String> entries = new LinkedHashMap<>();
        if (style == null || style.isBlank()) {
            return entries;
        }
        for (String token : style.split(";")) {
            String trimmed = token.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int eq = trimmed.indexOf('=');
            if (eq < 0) {
                entries.put(trimmed, FLAG);
            } else {
                entries.put(trimmed.substring(0, eq).trim(), trimmed.substring(eq + 1).trim());
            }
        }
        return entries;
    }

    public static String format(Map<String, String> entries) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> entry : entries.entrySet()) {
            sb.append(entry.getKey());
            if (!FLAG.equals(entry.getValue())) {
                sb.append('=').append(entry.getValue());
            }
            sb.append(';');
        }
        return sb.toString();
    }

    public static String value(String style, String key) {
        return parse(style).get(key);
    }

    /**
     * Resolves the shape of a vertex from its style. The {@code shape=} value wins over bare
     * tokens; a style with no known token is a rectangle.
     */
    public static ShapeKind inferShape(String style) {
        Map<String, String> entries = parse(style);

        String shapeValue = entries.get("shape");
        if (shapeValue != null) {
            ShapeKind kind = ShapeKind.forToken(shapeValue);
            if (kind != null) {
                return kind;
            }
        }

        for (Map.Entry<String, String> entry : entries.entrySet()) {
            if (FLAG.equals(entry.getValue())) {
                ShapeKind kind = ShapeKind.forToken(entry.getKey());
                if (kind != null) {
                    return kind;
                }
            }
        }

        if (shapeValue != null) {
            log.debug("Unknown shape '{}' in style '{}', treating as rectangle", shapeValue, style);
        }
        return ShapeKind.RECTANGLE;
    }

    /**
     * Replaces the shape-defining tokens of a style with those of the given kind and keeps every
     * other entry in place.
     */
    public static String withShape(String style, ShapeKind shape) {
        Map<String, String> entries = parse(style);
        List<String> shapeKeys = new ArrayList<>();
        for (Map.Entry<String, String> entry : entries.entrySet()) {
            if (FLAG.equals(entry.getValue()) && ShapeKind.isShapeToken(entry.getKey())) {
                shapeKeys.add(entry.getKey());
            }
        }
        shapeKeys.forEach(entries::remove);
        entries.remove("shape");
        entries.remove("perimeter");

        Map<String, String> result = new LinkedHashMap<>(parse(shape.canonicalStyle()));
        entries.forEach(result::putIfAbsent);
        return format(result);
    }

    public static boolean isHtml(String style) {
        return "1".equals(value(style, "html"));
    }

    public static String subStepOwner(String style) {
        String owner = value(style, SUB_STEP_OF);
        return owner == null || owner.isEmpty() ? null : owner;
    }

    public static String withSubStepOwner(String style, String ownerId) {
        Map<String, String> entries = parse(style);
        entries.put(SUB_STEP_OF, ownerId);
        return format(entries);
    }
}
