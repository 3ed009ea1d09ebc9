package com.tierflow.core.persistence;

import com.tierflow.core.model.OrchestrationException;

/**
 * Thrown when a checkpoint cannot be written or read, or is written out of order.
 */
public class CheckpointException extends OrchestrationException {
    public CheckpointException(String message) {
        super(message);
    }

    public CheckpointException(String message, Throwable cause) {
        super(message, cause);
    }
}
