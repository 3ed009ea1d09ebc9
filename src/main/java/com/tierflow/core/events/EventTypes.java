package com.tierflow.core.events;

/**
 * Event type names published on the {@link EventBus}.
 */
public final class EventTypes {

    private EventTypes() {}

    public static final String TASK_SUBMITTED = "task.submitted";
    public static final String TASK_RESUMED = "task.resumed";
    public static final String NODE_DISPATCHED = "node.dispatched";
    public static final String NODE_COMPLETED = "node.completed";
    public static final String NODE_RETRY_SCHEDULED = "node.retry_scheduled";
    public static final String NODE_TIMED_OUT = "node.timed_out";
    public static final String NODE_BACKPRESSURE = "node.backpressure";
    public static final String TASK_ESCALATED = "task.escalated";
    public static final String TASK_TIER_RESET = "task.tier_reset";
    public static final String TASK_FANNED_OUT = "task.fanned_out";
    public static final String BRANCH_COMPLETED = "branch.completed";
    public static final String TASK_FANNED_IN = "task.fanned_in";
    public static final String TASK_SUCCEEDED = "task.succeeded";
    public static final String TASK_FAILED = "task.failed";
    public static final String TASK_CANCELLED = "task.cancelled";
    public static final String CHECKPOINT_FAILED = "checkpoint.failed";
    public static final String AGENT_HEALTH_CHANGED = "agent.health_changed";
    public static final String ALERT_RAISED = "alert.raised";
}
