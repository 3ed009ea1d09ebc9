package com.tierflow.core.model;

/**
 * Base class for errors raised by the orchestration engine.
 */
public class OrchestrationException extends RuntimeException {
    public OrchestrationException(String message) {
        super(message);
    }

    public OrchestrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
