package com.tierflow.core.scheduler;

import com.tierflow.core.model.Priority;

import java.util.Comparator;
import java.util.HashSet;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Work ready for dispatch, highest priority first and FIFO within a priority.
 * Owned by the dispatch loop; not thread-safe.
 */
class ReadyQueue {

    record Item(String unitId, Priority priority, long order) {}

    private static final Comparator<Item> ORDER = Comparator
            .comparingInt((Item item) -> item.priority().rank()).reversed()
            .thenComparingLong(Item::order);

    private final PriorityQueue<Item> queue = new PriorityQueue<>(ORDER);
    private final Set<String> queued = new HashSet<>();
    private long counter;

    /**
     * Enqueues a unit unless it is already waiting.
     *
     * @return false when the unit was already queued
     */
    boolean offer(String unitId, Priority priority) {
        if (!queued.add(unitId)) {
            return false;
        }
        queue.add(new Item(unitId, priority, counter++));
        return true;
    }

    /**
     * Puts back an item taken earlier, keeping its original place in line.
     */
    boolean requeue(Item item) {
        if (!queued.add(item.unitId())) {
            return false;
        }
        queue.add(item);
        return true;
    }

    Item poll() {
        Item item = queue.poll();
        if (item != null) {
            queued.remove(item.unitId());
        }
        return item;
    }

    boolean remove(String unitId) {
        if (!queued.remove(unitId)) {
            return false;
        }
        return queue.removeIf(item -> item.unitId().equals(unitId));
    }

    boolean contains(String unitId) {
        return queued.contains(unitId);
    }

    int size() {
        return queue.size();
    }

    boolean isEmpty() {
        return queue.isEmpty();
    }
}
