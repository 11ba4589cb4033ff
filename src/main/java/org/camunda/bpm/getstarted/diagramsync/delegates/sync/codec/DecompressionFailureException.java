package org.camunda.bpm.getstarted.diagramsync.delegates.sync.codec;

/**
 * Thrown when a diagram payload is neither raw-deflate nor zlib compressed data.
 */
public class DecompressionFailureException extends RuntimeException {

    public DecompressionFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
