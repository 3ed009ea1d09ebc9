package com.tierflow.core.model;

/**
 * Health level of a registered agent. Transitions move one level at a time.
 */
public enum AgentHealth {
    HEALTHY,
    DEGRADED,
    UNAVAILABLE;

    public AgentHealth worse() {
        return this == HEALTHY ? DEGRADED : UNAVAILABLE;
    }

    public AgentHealth better() {
        return this == UNAVAILABLE ? DEGRADED : HEALTHY;
    }
}
