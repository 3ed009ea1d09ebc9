package com.tierflow.core.model;

/**
 * Outcome recorded in a task's history for one node.
 */
public enum NodeOutcome {
    SUCCEEDED,
    ROUTED,
    EXHAUSTED,
    FATAL,
    TERMINAL_SUCCESS,
    TERMINAL_FAILURE,
    UNAVAILABLE,
    CANCELLED
}
