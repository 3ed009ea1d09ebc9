package com.tierflow.core.agent;

/**
 * Domain logic of one agent, opaque to the engine.
 * <p>
 * Implementations may block (e.g. on an inference provider) and must respect
 * {@link AgentContext#deadline()} and {@link AgentContext#cancellation()} on a
 * best-effort basis. A thrown exception is treated as a transient error.
 */
@FunctionalInterface
public interface AgentExecutor {
    AgentResult process(AgentContext context) throws Exception;
}
