package com.tierflow.core.persistence;

import java.time.Instant;

/**
 * One durable snapshot of a task.
 *
 * @param taskId         task the snapshot belongs to
 * @param state          serialized {@link com.tierflow.core.model.TaskState} (JSON)
 * @param sequenceNumber state version; strictly increasing per task
 * @param timestamp      when the snapshot was taken
 */
public record Checkpoint(
    String taskId,
    String state,
    long sequenceNumber,
    Instant timestamp
) {
}
