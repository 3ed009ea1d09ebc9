package com.tierflow.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process publish/subscribe for task lifecycle, alert and agent-health events.
 * <p>
 * Delivery is synchronous on the publishing thread. Events carrying a task id are
 * delivered under that task's lock: a subscriber receives one task's events one at a
 * time and in publish order, whichever threads publish them. Within a single event,
 * subscribers are called in the order they subscribed, whether scoped to a task,
 * filtered or global. A subscriber that throws is logged and skipped.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private static final int LOCK_STRIPES = 64;

    private final CopyOnWriteArrayList<Subscriber> subscribers = new CopyOnWriteArrayList<>();
    private final Object[] taskLocks = new Object[LOCK_STRIPES];

    public EventBus() {
        for (int i = 0; i < taskLocks.length; i++) {
            taskLocks[i] = new Object();
        }
    }

    public void publish(OrchestrationEvent event) {
        log.debug("Publishing {} for task {}", event.eventType(), event.taskId());
        if (event.taskId() == null) {
            deliver(event);
            return;
        }
        synchronized (lockFor(event.taskId())) {
            deliver(event);
        }
    }

    /**
     * Events of one task only.
     */
    public Subscription subscribe(String taskId, Consumer<OrchestrationEvent> consumer) {
        return add(new Subscriber(taskId, EventFilter.all(), consumer));
    }

    public Subscription subscribe(EventFilter filter, Consumer<OrchestrationEvent> consumer) {
        return add(new Subscriber(null, filter, consumer));
    }

    public Subscription subscribeAll(Consumer<OrchestrationEvent> consumer) {
        return add(new Subscriber(null, EventFilter.all(), consumer));
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private Subscription add(Subscriber subscriber) {
        subscribers.add(subscriber);
        log.debug("Subscribed to {}", subscriber.taskId != null ? "task " + subscriber.taskId : "all tasks");
        return () -> subscribers.remove(subscriber);
    }

    private void deliver(OrchestrationEvent event) {
        for (Subscriber subscriber : subscribers) {
            if (!subscriber.accepts(event)) {
                continue;
            }
            try {
                subscriber.consumer.accept(event);
            } catch (Exception e) {
                log.warn("Subscriber failed on {} for task {}: {}", event.eventType(), event.taskId(), e.getMessage(), e);
            }
        }
    }

    private Object lockFor(String taskId) {
        return taskLocks[Math.floorMod(taskId.hashCode(), LOCK_STRIPES)];
    }

    /**
     * Compared by identity, so subscribing the same consumer twice yields two subscriptions.
     */
    private static final class Subscriber {
        final String taskId;
        final EventFilter filter;
        final Consumer<OrchestrationEvent> consumer;

        Subscriber(String taskId, EventFilter filter, Consumer<OrchestrationEvent> consumer) {
            this.taskId = taskId;
            this.filter = filter;
            this.consumer = consumer;
        }

        boolean accepts(OrchestrationEvent event) {
            return (taskId == null || taskId.equals(event.taskId())) && filter.test(event);
        }
    }
}
