package com.tierflow.core.events;

import java.util.Set;
import java.util.function.Predicate;

/**
 * Selects which events a subscriber receives.
 */
@FunctionalInterface
public interface EventFilter extends Predicate<OrchestrationEvent> {

    static EventFilter all() {
        return event -> true;
    }

    static EventFilter forTask(String taskId) {
        return event -> taskId.equals(event.taskId());
    }

    static EventFilter ofTypes(String... eventTypes) {
        Set<String> types = Set.of(eventTypes);
        return event -> types.contains(event.eventType());
    }
}
