package com.tierflow.core.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Aggregated outcomes over one sliding window.
 *
 * @param total             recorded outcomes
 * @param successes         successful outcomes
 * @param failures          failed outcomes
 * @param avgDurationMs     mean duration, 0 when empty
 * @param durationHistogram counts per duration bucket, keyed by upper bound label
 */
public record AgentWindowStats(
    long total,
    long successes,
    long failures,
    double avgDurationMs,
    Map<String, Long> durationHistogram
) {

    public static final AgentWindowStats EMPTY = new AgentWindowStats(0, 0, 0, 0.0, Map.of());

    @JsonProperty
    public double successRate() {
        return total == 0 ? 0.0 : (double) successes / total;
    }

    @JsonProperty
    public double failureRate() {
        return total == 0 ? 0.0 : (double) failures / total;
    }

    /**
     * Composite ranking score: success rate weighted by volume.
     */
    @JsonProperty
    public double performanceScore() {
        return successRate() * total;
    }
}
