package com.tierflow.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of a task moving through the workflow graph.
 * <p>
 * The scheduler's dispatch loop is the only writer: every transition produces a new
 * snapshot via the {@code with*} methods, bumps {@link #sequence()}, and hands the
 * snapshot to the checkpoint store and to agents. Fan-out branches are themselves
 * {@code TaskState}s (with {@link #parentTaskId()} set) carried in {@link #branches()}.
 *
 * @param taskId         unique task identifier (branch ids are {@code parentId#branchNode})
 * @param entryNode      node the task was submitted at
 * @param payload        opaque payload, merged with agent outputs on success; top-level
 *                       integral numbers are held as {@code Long}, floating-point ones as {@code Double}
 * @param priority       dispatch priority
 * @param currentNode    a graph node id, or {@link #SUCCEEDED_MARKER} / {@link #FAILED_MARKER}
 * @param tier           tier currently owning the task
 * @param history        append-only execution history
 * @param retryCounts    transient-failure retries per node, never above the node's max
 * @param escalationCount escalations so far, never reset
 * @param status         lifecycle status
 * @param branches       fan-out branch states in declaration order; empty outside fan-out
 * @param parentTaskId   owning task for a branch; null for top-level tasks
 * @param sequence       state version, equal to the checkpoint sequence number
 * @param createdAt      submission time
 * @param updatedAt      time of the last committed transition
 * @param slaDeadline    time the task should finish by, derived from priority
 * @param failureReason  reason recorded on the FAILED transition; null otherwise
 */
public record TaskState(
    String taskId,
    String entryNode,
    Map<String, Object> payload,
    Priority priority,
    String currentNode,
    Tier tier,
    List<HistoryEntry> history,
    Map<String, Integer> retryCounts,
    int escalationCount,
    TaskStatus status,
    List<TaskState> branches,
    String parentTaskId,
    long sequence,
    Instant createdAt,
    Instant updatedAt,
    Instant slaDeadline,
    String failureReason
) implements Serializable {

    public static final String SUCCEEDED_MARKER = "$succeeded";
    public static final String FAILED_MARKER = "$failed";

    public TaskState {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(normalizeNumbers(payload));
        history = history == null ? List.of() : List.copyOf(history);
        retryCounts = retryCounts == null ? Map.of() : Map.copyOf(retryCounts);
        branches = branches == null ? List.of() : List.copyOf(branches);
        priority = priority == null ? Priority.MEDIUM : priority;
        tier = tier == null ? Tier.OPERATIONAL : tier;
        status = status == null ? TaskStatus.RUNNING : status;
    }

    /**
     * Creates the initial state of a freshly submitted task.
     */
    public static TaskState initial(String taskId, String entryNode, Map<String, Object> payload,
                                    Priority priority, Tier tier, Instant now) {
        return new TaskState(taskId, entryNode, payload, priority, entryNode, tier,
                List.of(), Map.of(), 0, TaskStatus.RUNNING, List.of(), null, 0L,
                now, now, now.plus(priority.sla()), null);
    }

    public static boolean terminalMarker(String nodeId) {
        return SUCCEEDED_MARKER.equals(nodeId) || FAILED_MARKER.equals(nodeId);
    }

    public boolean branch() {
        return parentTaskId != null;
    }

    private static Map<String, Object> normalizeNumbers(Map<String, Object> payload) {
        Map<String, Object> copy = new HashMap<>(payload.size());
        payload.forEach((key, value) -> copy.put(key, normalizeNumber(value)));
        return copy;
    }

    private static Object normalizeNumber(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float f) {
            return f.doubleValue();
        }
        return value;
    }

    public int retryCount(String nodeId) {
        return retryCounts.getOrDefault(nodeId, 0);
    }

    /**
     * Returns a numeric payload field as a double, or null when absent or not numeric.
     */
    public Double numericField(String field) {
        Object value = payload.get(field);
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    // -- Transitions (each returns a new snapshot with sequence + 1) --

    public TaskState withPayloadMerged(Map<String, Object> output, Instant now) {
        if (output == null || output.isEmpty()) {
            return touch(now);
        }
        var merged = new HashMap<>(payload);
        merged.putAll(output);
        return new TaskState(taskId, entryNode, merged, priority, currentNode, tier, history,
                retryCounts, escalationCount, status, branches, parentTaskId, sequence + 1,
                createdAt, now, slaDeadline, failureReason);
    }

    public TaskState withHistory(HistoryEntry entry) {
        var next = new ArrayList<>(history);
        next.add(entry);
        return new TaskState(taskId, entryNode, payload, priority, currentNode, tier, next,
                retryCounts, escalationCount, status, branches, parentTaskId, sequence + 1,
                createdAt, entry.timestamp(), slaDeadline, failureReason);
    }

    public TaskState withRetryCount(String nodeId, int count, Instant now) {
        var next = new HashMap<>(retryCounts);
        next.put(nodeId, count);
        return new TaskState(taskId, entryNode, payload, priority, currentNode, tier, history,
                next, escalationCount, status, branches, parentTaskId, sequence + 1,
                createdAt, now, slaDeadline, failureReason);
    }

    public TaskState movedTo(String nodeId, Instant now) {
        return new TaskState(taskId, entryNode, payload, priority, nodeId, tier, history,
                retryCounts, escalationCount, status, branches, parentTaskId, sequence + 1,
                createdAt, now, slaDeadline, failureReason);
    }

    public TaskState escalatedTo(String nodeId, Tier newTier, Instant now) {
        return new TaskState(taskId, entryNode, payload, priority, nodeId, newTier, history,
                retryCounts, escalationCount + 1, status, branches, parentTaskId, sequence + 1,
                createdAt, now, slaDeadline, failureReason);
    }

    public TaskState withTierReset(Tier resetTo, Instant now) {
        return new TaskState(taskId, entryNode, payload, priority, currentNode, resetTo, history,
                retryCounts, escalationCount, status, branches, parentTaskId, sequence + 1,
                createdAt, now, slaDeadline, failureReason);
    }

    public TaskState awaitingFanIn(String joinNode, List<TaskState> branchStates, Instant now) {
        return new TaskState(taskId, entryNode, payload, priority, joinNode, tier, history,
                retryCounts, escalationCount, TaskStatus.AWAITING_FAN_IN, branchStates, parentTaskId,
                sequence + 1, createdAt, now, slaDeadline, failureReason);
    }

    public TaskState withBranches(List<TaskState> branchStates, Instant now) {
        return new TaskState(taskId, entryNode, payload, priority, currentNode, tier, history,
                retryCounts, escalationCount, status, branchStates, parentTaskId, sequence + 1,
                createdAt, now, slaDeadline, failureReason);
    }

    /**
     * Leaves fan-in: installs the merged payload and history, drops branch states.
     */
    public TaskState joined(Map<String, Object> mergedPayload, List<HistoryEntry> mergedHistory, Instant now) {
        return new TaskState(taskId, entryNode, mergedPayload, priority, currentNode, tier, mergedHistory,
                retryCounts, escalationCount, TaskStatus.RUNNING, List.of(), parentTaskId, sequence + 1,
                createdAt, now, slaDeadline, failureReason);
    }

    public TaskState succeeded(Instant now) {
        return new TaskState(taskId, entryNode, payload, priority, SUCCEEDED_MARKER, tier, history,
                retryCounts, escalationCount, TaskStatus.SUCCEEDED, branches, parentTaskId, sequence + 1,
                createdAt, now, slaDeadline, null);
    }

    public TaskState failed(String reason, Instant now) {
        return new TaskState(taskId, entryNode, payload, priority, FAILED_MARKER, tier, history,
                retryCounts, escalationCount, TaskStatus.FAILED, branches, parentTaskId, sequence + 1,
                createdAt, now, slaDeadline, reason);
    }

    /**
     * Creates a branch clone: shares the payload, starts a branch-local history.
     */
    public TaskState forkBranch(String branchNode, Instant now) {
        return new TaskState(taskId + "#" + branchNode, entryNode, payload, priority, branchNode, tier,
                List.of(), Map.of(), escalationCount, TaskStatus.RUNNING, List.of(), taskId, 0L,
                now, now, slaDeadline, null);
    }

    private TaskState touch(Instant now) {
        return new TaskState(taskId, entryNode, payload, priority, currentNode, tier, history,
                retryCounts, escalationCount, status, branches, parentTaskId, sequence + 1,
                createdAt, now, slaDeadline, failureReason);
    }
}
