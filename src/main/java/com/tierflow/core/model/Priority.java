package com.tierflow.core.model;

import java.time.Duration;

/**
 * Dispatch priority of a task. Higher priorities are popped first from the ready queue.
 * Each priority carries the SLA the task is expected to finish within.
 */
public enum Priority {
    LOW(0, Duration.ofHours(72)),
    MEDIUM(1, Duration.ofHours(24)),
    HIGH(2, Duration.ofHours(4)),
    CRITICAL(3, Duration.ofHours(1));

    private final int rank;
    private final Duration sla;

    Priority(int rank, Duration sla) {
        this.rank = rank;
        this.sla = sla;
    }

    public int rank() {
        return rank;
    }

    public Duration sla() {
        return sla;
    }
}
