package com.datapipe.orchestrator.reporter;

/**
 * Thrown when a status update could not be delivered to the store.
 * Distinct from a failure of the stage that produced the update.
 */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
