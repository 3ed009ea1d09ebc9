package com.tierflow.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * One append-only entry in a task's execution history.
 *
 * @param nodeId    the node that produced the outcome
 * @param timestamp when the outcome was applied by the scheduler
 * @param outcome   what happened at the node
 * @param tier      the tier the task held when the node completed
 * @param detail    free-form detail (error message, escalation reason); nullable
 */
public record HistoryEntry(
    String nodeId,
    Instant timestamp,
    NodeOutcome outcome,
    Tier tier,
    String detail
) implements Serializable {
}
