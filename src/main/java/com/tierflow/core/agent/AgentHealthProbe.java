package com.tierflow.core.agent;

/**
 * Liveness probe for one agent, invoked by the registry's periodic health check.
 */
@FunctionalInterface
public interface AgentHealthProbe {

    AgentHealthProbe ALWAYS_UP = () -> true;

    boolean probe() throws Exception;
}
