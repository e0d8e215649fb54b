package com.datapipe.orchestrator.service;

/**
 * Thrown when a request is malformed: unknown status value, missing
 * required field, negative record count.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
