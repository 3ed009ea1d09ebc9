package com.tierflow.core.scheduler;

/**
 * Where a unit of work (a task or one of its fan-out branches) sits in the dispatch cycle.
 * <pre>
 * QUEUED -> DISPATCHING -> AWAITING_AGENT -> (APPLYING | TIMED_OUT) -> BACKOFF -> QUEUED ...
 *                                                          ... -> SUCCEEDED | FAILED
 * </pre>
 */
public enum DispatchPhase {
    QUEUED,
    DISPATCHING,
    AWAITING_AGENT,
    APPLYING,
    TIMED_OUT,
    BACKOFF,
    AWAITING_FAN_IN,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
