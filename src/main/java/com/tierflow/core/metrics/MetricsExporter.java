package com.tierflow.core.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tierflow.core.alerting.Alert;
import com.tierflow.core.alerting.AlertEngine;
import com.tierflow.core.model.OrchestrationException;
import com.tierflow.core.repository.Campaign;
import com.tierflow.core.repository.CampaignRepository;
import com.tierflow.core.repository.Client;
import com.tierflow.core.repository.ClientRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders window snapshots for operators: JSON for machines, a fixed-width table for
 * humans. Snapshots carry the alerts raised within the window and a business section
 * computed from the client and campaign repositories.
 */
@Service
public class MetricsExporter {

    private static final Logger log = LoggerFactory.getLogger(MetricsExporter.class);

    private final MetricsCollector collector;
    private final AlertEngine alertEngine;
    private final ClientRepository clients;
    private final CampaignRepository campaigns;
    private final ObjectMapper objectMapper;

    @Autowired
    public MetricsExporter(MetricsCollector collector, AlertEngine alertEngine,
                           ClientRepository clients, CampaignRepository campaigns) {
        this(collector, alertEngine, clients, campaigns, new ObjectMapper());
    }

    public MetricsExporter(MetricsCollector collector, AlertEngine alertEngine,
                           ClientRepository clients, CampaignRepository campaigns, ObjectMapper objectMapper) {
        this.collector = collector;
        this.alertEngine = alertEngine;
        this.clients = clients;
        this.campaigns = campaigns;
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public MetricsSnapshot snapshot(MetricsWindow window) {
        MetricsSnapshot base = collector.snapshot(window);
        Instant since = base.timestamp().minus(window.span());
        List<Alert> current = alertEngine == null ? List.of() : alertEngine.alerts().stream()
                .filter(a -> !a.timestamp().isBefore(since))
                .toList();
        return base.withAlerts(current).withBusiness(business(since));
    }

    // new clients are those created inside the window; pipeline value annualises monthly budgets
    private MetricsSnapshot.BusinessSummary business(Instant since) {
        var builder = new BusinessSummaryBuilder();
        if (clients != null) {
            for (Client client : clients.findAll()) {
                builder.client(client, since);
            }
        }
        if (campaigns != null) {
            for (Campaign campaign : campaigns.findAll()) {
                builder.campaign(campaign);
            }
        }
        return builder.build();
    }

    public String toJson(MetricsWindow window) {
        return toJson(snapshot(window));
    }

    public String toJson(MetricsSnapshot snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new OrchestrationException("Failed to serialize metrics snapshot: " + e.getMessage(), e);
        }
    }

    public String toTable(MetricsWindow window) {
        return toTable(snapshot(window));
    }

    public String toTable(MetricsSnapshot snapshot) {
        var sb = new StringBuilder();
        sb.append("Metrics window ").append(snapshot.window()).append(" at ").append(snapshot.timestamp()).append('\n');
        sb.append('\n');
        sb.append(String.format(Locale.ROOT, "%-24s %8s %8s %12s %10s%n", "AGENT", "TASKS", "SUCCESS", "AVG MS", "SCORE"));
        for (Map.Entry<String, AgentWindowStats> entry : snapshot.agents().entrySet()) {
            AgentWindowStats s = entry.getValue();
            sb.append(String.format(Locale.ROOT, "%-24s %8d %7.1f%% %12.1f %10.2f%n",
                    entry.getKey(), s.total(), s.successRate() * 100, s.avgDurationMs(), s.performanceScore()));
        }
        if (snapshot.agents().isEmpty()) {
            sb.append("(no agent activity)\n");
        }

        sb.append('\n');
        AgentWindowStats tasks = snapshot.tasks();
        if (tasks != null) {
            sb.append(String.format(Locale.ROOT, "Tasks: %d finished, %d succeeded, %d failed, avg %.1f ms%n",
                    tasks.total(), tasks.successes(), tasks.failures(), tasks.avgDurationMs()));
        }
        AgentWindowStats http = snapshot.http();
        if (http != null && http.total() > 0) {
            sb.append(String.format(Locale.ROOT, "HTTP: %d requests, error rate %.1f%%%n",
                    http.total(), http.failureRate() * 100));
        }
        MetricsSnapshot.SystemSample system = snapshot.system();
        if (system != null) {
            sb.append(String.format(Locale.ROOT, "System: cpu %.1f%%, memory %.1f%% (sampled %s)%n",
                    system.cpuPercent(), system.memoryPercent(), system.sampledAt()));
        }

        if (!snapshot.topAgents().isEmpty()) {
            sb.append('\n').append("Top agents:\n");
            int rank = 1;
            for (MetricsSnapshot.AgentRanking r : snapshot.topAgents()) {
                sb.append(String.format(Locale.ROOT, "  %d. %s (score %.2f)%n", rank++, r.agentId(), r.performanceScore()));
            }
        }

        sb.append('\n').append("Alerts: ").append(snapshot.alerts().size()).append('\n');
        for (Alert alert : snapshot.alerts()) {
            sb.append("  [").append(alert.severity()).append("] ").append(alert.kind().code())
                    .append(": ").append(alert.message()).append('\n');
        }

        MetricsSnapshot.BusinessSummary b = snapshot.business();
        if (b != null) {
            sb.append('\n');
            sb.append(String.format(Locale.ROOT, "Clients: %d (%d new), pipeline %.2f%n",
                    b.totalClients(), b.newClients(), b.pipelineValue()));
            sb.append(String.format(Locale.ROOT, "Campaigns: %d (%d active), leads %d (%d qualified, %.1f%%), revenue %.2f%n",
                    b.totalCampaigns(), b.activeCampaigns(), b.totalLeads(), b.qualifiedLeads(),
                    b.leadConversionRate() * 100, b.totalRevenue()));
        }
        return sb.toString();
    }

    /**
     * Writes the JSON snapshot of {@code window} to {@code target}, creating parent
     * directories as needed.
     */
    public Path exportTo(Path target, MetricsWindow window) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, toJson(window));
            log.info("Exported {} metrics to {}", window.label(), target);
            return target;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to export metrics to " + target, e);
        }
    }

    static final class BusinessSummaryBuilder {
        private long totalClients;
        private long newClients;
        private double pipelineValue;
        private long totalCampaigns;
        private long activeCampaigns;
        private long totalLeads;
        private long qualifiedLeads;
        private double totalRevenue;

        void client(Client client, Instant since) {
            totalClients++;
            if (client.createdAt() != null && !client.createdAt().isBefore(since)) {
                newClients++;
            }
            if (client.monthlyBudget() != null) {
                pipelineValue += client.monthlyBudget() * 12;
            }
        }

        void campaign(Campaign campaign) {
            totalCampaigns++;
            if (campaign.active()) {
                activeCampaigns++;
            }
            totalLeads += campaign.totalLeads();
            qualifiedLeads += campaign.qualifiedLeads();
            totalRevenue += campaign.revenueAttributed();
        }

        MetricsSnapshot.BusinessSummary build() {
            double conversion = totalLeads > 0 ? (double) qualifiedLeads / totalLeads : 0.0;
            return new MetricsSnapshot.BusinessSummary(totalClients, newClients, pipelineValue,
                    totalCampaigns, activeCampaigns, totalLeads, qualifiedLeads, conversion, totalRevenue);
        }
    }
}
