package com.tierflow.core.escalation;

/**
 * Named, per-deployment escalation rule: when {@code node} completes and the payload
 * field {@code field} is at least {@code amount}, the task escalates one tier to
 * {@code target}.
 *
 * @param name   rule name used in logs, events and history
 * @param node   node whose completion triggers the check
 * @param field  numeric payload field to read
 * @param amount inclusive threshold
 * @param target node the task escalates to
 */
public record ValueThreshold(
    String name,
    String node,
    String field,
    double amount,
    String target
) {

    public boolean appliesTo(String nodeId) {
        return node != null && node.equals(nodeId);
    }
}
