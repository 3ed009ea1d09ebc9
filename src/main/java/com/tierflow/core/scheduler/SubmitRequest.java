package com.tierflow.core.scheduler;

import com.tierflow.core.model.Priority;

import java.util.Map;

/**
 * A task submission.
 *
 * @param taskId    caller-supplied id; generated when null or blank
 * @param entryNode graph entry point the task starts at
 * @param payload   initial payload
 * @param priority  dispatch priority; MEDIUM when null
 */
public record SubmitRequest(
    String taskId,
    String entryNode,
    Map<String, Object> payload,
    Priority priority
) {

    public SubmitRequest {
        payload = payload == null ? Map.of() : payload;
        priority = priority == null ? Priority.MEDIUM : priority;
    }

    public static SubmitRequest of(String entryNode, Map<String, Object> payload, Priority priority) {
        return new SubmitRequest(null, entryNode, payload, priority);
    }
}
