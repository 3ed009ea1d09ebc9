package com.tierflow.core.agent;

import com.tierflow.core.model.AgentHealth;

/**
 * An executor picked by {@link AgentRegistry#resolve}, with the descriptor it was registered under.
 *
 * @param descriptor   agent descriptor
 * @param executor     executor to invoke
 * @param health       health at resolution time
 * @param substituted  true when resolved through the substitute capability tag
 */
public record ResolvedAgent(
    AgentDescriptor descriptor,
    AgentExecutor executor,
    AgentHealth health,
    boolean substituted
) {

    public String agentId() {
        return descriptor.id();
    }
}
