package com.tierflow.core.agent;

import com.tierflow.core.model.OrchestrationException;

/**
 * Thrown when the registry cannot resolve a healthy executor for a capability,
 * including the configured substitute capability.
 */
public class AgentUnavailableException extends OrchestrationException {

    private final String capabilityTag;

    public AgentUnavailableException(String capabilityTag, String message) {
        super(message);
        this.capabilityTag = capabilityTag;
    }

    public String getCapabilityTag() {
        return capabilityTag;
    }
}
