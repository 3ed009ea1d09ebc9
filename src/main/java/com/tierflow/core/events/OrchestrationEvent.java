package com.tierflow.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A task-lifecycle event emitted by the scheduler (and by the registry / alert engine).
 *
 * @param eventType event type, one of {@link EventTypes}
 * @param taskId    top-level task the event belongs to; nullable for system events
 * @param nodeId    node the event relates to; nullable
 * @param agentId   agent the event relates to; nullable
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record OrchestrationEvent(
    String eventType,
    String taskId,
    String nodeId,
    String agentId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public OrchestrationEvent {
        payload = payload == null ? Map.of() : payload;
    }

    public Object get(String key) {
        return payload.get(key);
    }
}
