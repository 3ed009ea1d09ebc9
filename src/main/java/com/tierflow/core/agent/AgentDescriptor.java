package com.tierflow.core.agent;

import com.tierflow.core.model.Tier;

import java.util.Objects;
import java.util.Set;

/**
 * Static description of a registered agent.
 *
 * @param id               unique agent identifier (e.g. "lead_qualification")
 * @param tier             hierarchy tier the agent belongs to
 * @param capabilityTags   capabilities the agent can serve
 * @param concurrencyLimit maximum number of calls executing against this agent at once
 */
public record AgentDescriptor(
    String id,
    Tier tier,
    Set<String> capabilityTags,
    int concurrencyLimit
) {

    public AgentDescriptor {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(tier, "tier");
        capabilityTags = capabilityTags == null ? Set.of() : Set.copyOf(capabilityTags);
        if (concurrencyLimit <= 0) {
            throw new IllegalArgumentException("concurrencyLimit must be > 0 for agent " + id);
        }
    }

    public boolean hasCapability(String tag) {
        return capabilityTags.contains(tag);
    }
}
