package org.camunda.bpm.getstarted.diagramsync.delegates.sync.patch;

/**
 * Thrown when a patched body breaks the graph model: missing root, duplicate ids or edges
 * pointing at cells that do not exist.
 */
public class StructuralValidationException extends RuntimeException {

    public StructuralValidationException(String message) {
        super(message);
    }

    public StructuralValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
