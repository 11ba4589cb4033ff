package org.camunda.bpm.getstarted.diagramsync.delegates.sync.patch;

/**
 * Thrown when no free cell id could be found within the configured number of attempts.
 */
public class IdentifierExhaustionException extends RuntimeException {

    public IdentifierExhaustionException(String message) {
        super(message);
    }
}
