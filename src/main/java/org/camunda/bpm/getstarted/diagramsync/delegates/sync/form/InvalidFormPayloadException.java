package org.camunda.bpm.getstarted.diagramsync.delegates.sync.form;

/**
 * Thrown when edited form nodes are not valid JSON or do not match {@code schemas/form-nodes.schema.json}.
 */
public class InvalidFormPayloadException extends RuntimeException {

    public InvalidFormPayloadException(String message) {
        super(message);
    }

    public InvalidFormPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
