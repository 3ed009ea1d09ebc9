package com.tierflow.core.metrics;

import com.tierflow.core.alerting.Alert;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of one metrics window, as exported.
 *
 * @param window    window label (1h, 24h, 7d)
 * @param timestamp when the snapshot was taken
 * @param agents    per-agent statistics, keyed and ordered by agent id
 * @param tasks     system-wide task outcomes
 * @param http      HTTP request outcomes fed in externally (failures are error responses)
 * @param system    latest CPU / memory sample; null when none was fed
 * @param topAgents agents ranked by performance score
 * @param alerts    alerts current at export time
 * @param business  business section; null when not requested
 */
public record MetricsSnapshot(
    String window,
    Instant timestamp,
    Map<String, AgentWindowStats> agents,
    AgentWindowStats tasks,
    AgentWindowStats http,
    SystemSample system,
    List<AgentRanking> topAgents,
    List<Alert> alerts,
    BusinessSummary business
) {

    public MetricsSnapshot {
        agents = agents == null ? Map.of() : agents;
        topAgents = topAgents == null ? List.of() : List.copyOf(topAgents);
        alerts = alerts == null ? List.of() : List.copyOf(alerts);
    }

    public MetricsSnapshot withAlerts(List<Alert> currentAlerts) {
        return new MetricsSnapshot(window, timestamp, agents, tasks, http, system, topAgents, currentAlerts, business);
    }

    public MetricsSnapshot withBusiness(BusinessSummary summary) {
        return new MetricsSnapshot(window, timestamp, agents, tasks, http, system, topAgents, alerts, summary);
    }

    /**
     * Latest externally fed resource usage.
     */
    public record SystemSample(double cpuPercent, double memoryPercent, Instant sampledAt) {}

    /**
     * One row of the agent ranking.
     */
    public record AgentRanking(String agentId, double performanceScore, double successRate,
                               long totalTasks, double avgDurationMs) {}

    /**
     * Client and campaign figures from the business repositories.
     */
    public record BusinessSummary(
        long totalClients,
        long newClients,
        double pipelineValue,
        long totalCampaigns,
        long activeCampaigns,
        long totalLeads,
        long qualifiedLeads,
        double leadConversionRate,
        double totalRevenue
    ) {}
}
