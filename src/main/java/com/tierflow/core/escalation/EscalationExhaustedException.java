package com.tierflow.core.escalation;

import com.tierflow.core.model.OrchestrationException;

/**
 * Describes a refused escalation: the task already used every escalation it is allowed.
 * Never thrown across the scheduler boundary; carried as the failure cause of the
 * Terminal-Failed transition.
 */
public class EscalationExhaustedException extends OrchestrationException {

    private final String taskId;
    private final int escalationCount;

    public EscalationExhaustedException(String taskId, int escalationCount) {
        super("Escalation limit reached for task " + taskId + " after " + escalationCount + " escalation(s)");
        this.taskId = taskId;
        this.escalationCount = escalationCount;
    }

    public String getTaskId() {
        return taskId;
    }

    public int getEscalationCount() {
        return escalationCount;
    }
}
