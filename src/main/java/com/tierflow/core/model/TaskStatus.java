package com.tierflow.core.model;

/**
 * Lifecycle status of a task (or of one fan-out branch).
 */
public enum TaskStatus {
    RUNNING,
    AWAITING_FAN_IN,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
