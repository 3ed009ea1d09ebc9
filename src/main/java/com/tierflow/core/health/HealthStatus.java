package com.tierflow.core.health;

import java.util.Collection;
import java.util.Map;

/**
 * Health of one orchestration component: graph, scheduler, agents, checkpoints or database.
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {
    /** Ordered from best to worst. */
    public enum Status { UP, DEGRADED, DOWN }

    public static HealthStatus up(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.UP, detail, metadata);
    }

    public static HealthStatus degraded(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.DEGRADED, detail, metadata);
    }

    public static HealthStatus down(String component, String detail) {
        return new HealthStatus(component, Status.DOWN, detail, Map.of());
    }

    /**
     * Worst status among {@code statuses}; UP when empty.
     */
    public static Status worst(Collection<HealthStatus> statuses) {
        Status worst = Status.UP;
        for (HealthStatus s : statuses) {
            if (s.status().compareTo(worst) > 0) {
                worst = s.status();
            }
        }
        return worst;
    }
}
