package com.tierflow.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer meters for task orchestration, for external scraping.
 * The windowed view used for ranking and alerting lives in {@link MetricsCollector}.
 */
@Service
public class OrchestrationMetrics {

    private final MeterRegistry registry;

    public OrchestrationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordNodeExecution(String agentId, String outcome, long ms) {
        Timer.builder("tierflow.node.duration")
                .tag("agent", agentId)
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordTaskResult(String status) {
        Counter.builder("tierflow.tasks.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void incrementEscalations(String tier) {
        Counter.builder("tierflow.escalations.total")
                .tag("tier", tier)
                .register(registry)
                .increment();
    }

    public void recordRetry(String nodeId) {
        Counter.builder("tierflow.node.retries")
                .description("Transient failures that were retried after backoff")
                .tag("node", nodeId)
                .register(registry)
                .increment();
    }

    public void recordTimeout(String agentId) {
        Counter.builder("tierflow.node.timeouts")
                .tag("agent", agentId)
                .register(registry)
                .increment();
    }

    /**
     * Records work held back because the resolved agent was at its concurrency limit.
     */
    public void recordBackpressure(String agentId) {
        Counter.builder("tierflow.dispatch.backpressure")
                .description("Dispatches deferred because the agent was saturated")
                .tag("agent", agentId)
                .register(registry)
                .increment();
    }

    public void recordFanIn(int merged, int cancelled) {
        Counter.builder("tierflow.fanin.branches")
                .tag("result", "merged")
                .register(registry)
                .increment(merged);
        Counter.builder("tierflow.fanin.branches")
                .tag("result", "cancelled")
                .register(registry)
                .increment(cancelled);
    }

    public void recordCheckpointFailure() {
        Counter.builder("tierflow.checkpoint.failures")
                .register(registry)
                .increment();
    }

    public void recordAlert(String kind, String severity) {
        Counter.builder("tierflow.alerts.total")
                .tag("kind", kind)
                .tag("severity", severity)
                .register(registry)
                .increment();
    }
}
