package org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

/**
 * A sub-step listed under a process step in the form.
 *
 * @param name     the display name
 * @param shape    the shape of the sub-step vertex
 * @param parent   {@code "main"} or {@code "subprocess-<k>"}, a position in the sibling list
 * @param detected true when inferred from an off-flow vertex rather than entered by a user
 * @param branchId cell id of the vertex the sub-step was detected from
 * @param id       cell id of the sub-step vertex once it exists in the document
 */
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Subprocess(
        String name,
        ShapeKind shape,
        String parent,
        @JsonProperty("isDetected") boolean detected,
        String branchId,
        String id
) {
    public static final String MAIN_PARENT = "main";
    public static final String SIBLING_PARENT_PREFIX = "subprocess-";

    public Subprocess {
        if (shape == null) {
            shape = ShapeKind.RECTANGLE;
        }
        if (parent == null || parent.isBlank()) {
            parent = MAIN_PARENT;
        }
    }

    public static Subprocess named(String name) {
        return new Subprocess(name, ShapeKind.RECTANGLE, MAIN_PARENT, false, null, null);
    }

    public static String siblingParent(int index) {
        return SIBLING_PARENT_PREFIX + index;
    }

    /**
     * Returns the sibling position referenced by {@link #parent()}, or -1 for {@code "main"} and
     * anything that is not a well-formed positional reference.
     */
    public int parentIndex() {
        if (!parent.startsWith(SIBLING_PARENT_PREFIX)) {
            return -1;
        }
        try {
            int index = Integer.parseInt(parent.substring(SIBLING_PARENT_PREFIX.length()));
            return index >= 0 ? index : -1;
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    public boolean hasName() {
        return name != null && !name.trim().isEmpty();
    }
}
