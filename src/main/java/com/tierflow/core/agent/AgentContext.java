package com.tierflow.core.agent;

import com.tierflow.core.model.Tier;

import java.time.Instant;
import java.util.Map;

/**
 * Everything an agent receives for one invocation. The payload is an immutable
 * snapshot; agents report changes through {@link AgentResult#output()}.
 *
 * @param taskId       task (or branch) being processed
 * @param nodeId       graph node the call is made for
 * @param payload      payload snapshot
 * @param tier         tier the task currently holds
 * @param deadline     instant after which the scheduler treats the call as timed out
 * @param cancellation cooperative cancellation flag
 */
public record AgentContext(
    String taskId,
    String nodeId,
    Map<String, Object> payload,
    Tier tier,
    Instant deadline,
    CancellationSignal cancellation
) {

    public boolean isCancelled() {
        return cancellation != null && cancellation.isCancelled();
    }
}
