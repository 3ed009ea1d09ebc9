package com.tierflow.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Tierflow-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTask(String taskId) {
        MDC.put("taskId", taskId);
    }

    public static void setNode(String taskId, String nodeId, String agentId) {
        MDC.put("taskId", taskId);
        MDC.put("nodeId", nodeId);
        if (agentId != null) {
            MDC.put("agentId", agentId);
        } else {
            MDC.remove("agentId");
        }
    }

    public static void clear() {
        MDC.remove("taskId");
        MDC.remove("nodeId");
        MDC.remove("agentId");
    }
}
