package org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph;

/**
 * Thrown when a diagram body is not well-formed XML or has no graph model root.
 */
public class MalformedDocumentException extends RuntimeException {

    public MalformedDocumentException(String message) {
        super(message);
    }

    public MalformedDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
