package com.tierflow.core.scheduler;

import com.tierflow.core.model.OrchestrationException;

/**
 * Thrown synchronously from submit when a task cannot enter the graph
 * (unknown entry node, missing required payload field, duplicate task id).
 */
public class ValidationException extends OrchestrationException {
    public ValidationException(String message) {
        super(message);
    }
}
