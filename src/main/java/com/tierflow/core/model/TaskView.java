package com.tierflow.core.model;

import java.util.List;

/**
 * Read-only status of a task as returned to submitters.
 *
 * @param taskId        the task
 * @param status        lifecycle status
 * @param currentNode   current node or terminal marker
 * @param tier          current tier
 * @param history       execution history so far
 * @param phase         scheduler phase name (e.g. QUEUED, AWAITING_AGENT, BACKOFF)
 * @param escalationCount escalations so far
 * @param failureReason reason for FAILED; null otherwise
 */
public record TaskView(
    String taskId,
    TaskStatus status,
    String currentNode,
    Tier tier,
    List<HistoryEntry> history,
    String phase,
    int escalationCount,
    String failureReason
) {

    public static TaskView of(TaskState state, String phase) {
        return new TaskView(state.taskId(), state.status(), state.currentNode(), state.tier(),
                state.history(), phase, state.escalationCount(), state.failureReason());
    }
}
