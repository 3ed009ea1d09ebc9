package com.tierflow.core.escalation;

import com.tierflow.core.model.Tier;

/**
 * Outcome of an {@link EscalationPolicy} evaluation.
 */
public sealed interface EscalationDecision
        permits EscalationDecision.Proceed, EscalationDecision.Escalate, EscalationDecision.ResetTier,
                EscalationDecision.Succeed, EscalationDecision.Fail {

    /** Nothing to do; continue with normal graph routing. */
    record Proceed() implements EscalationDecision {}

    /** Move the task to {@code targetNode} at {@code newTier}. */
    record Escalate(String targetNode, Tier newTier, String reason) implements EscalationDecision {}

    /** Explicit reset of the task's tier; routing continues afterwards. */
    record ResetTier(Tier resetTo, String reason) implements EscalationDecision {}

    /** Terminal success. */
    record Succeed(String reason) implements EscalationDecision {}

    /**
     * Terminal failure. {@code escalationExhausted} marks a refused escalation.
     */
    record Fail(String reason, boolean escalationExhausted) implements EscalationDecision {}
}
