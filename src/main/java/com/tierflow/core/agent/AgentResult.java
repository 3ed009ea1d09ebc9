package com.tierflow.core.agent;

import java.util.Map;

/**
 * Result returned by an {@link AgentExecutor}. The engine never inspects
 * {@code output} beyond merging it into the task payload.
 *
 * @param status            result classification
 * @param output            fields to merge into the payload (success / terminal success)
 * @param error             error description for failures; nullable
 * @param terminalSucceeded for {@link Status#TERMINAL}: whether the task ends successfully
 */
public record AgentResult(
    Status status,
    Map<String, Object> output,
    String error,
    boolean terminalSucceeded
) {

    public enum Status { SUCCESS, TRANSIENT_ERROR, FATAL_ERROR, TERMINAL }

    public AgentResult {
        output = output == null ? Map.of() : output;
    }

    public static AgentResult success(Map<String, Object> output) {
        return new AgentResult(Status.SUCCESS, output, null, false);
    }

    public static AgentResult transientError(String error) {
        return new AgentResult(Status.TRANSIENT_ERROR, Map.of(), error, false);
    }

    public static AgentResult fatalError(String error) {
        return new AgentResult(Status.FATAL_ERROR, Map.of(), error, false);
    }

    public static AgentResult terminalSuccess(Map<String, Object> output) {
        return new AgentResult(Status.TERMINAL, output, null, true);
    }

    public static AgentResult terminalFailure(String error) {
        return new AgentResult(Status.TERMINAL, Map.of(), error, false);
    }
}
