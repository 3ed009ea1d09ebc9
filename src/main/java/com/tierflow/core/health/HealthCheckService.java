package com.tierflow.core.health;

import com.tierflow.core.agent.AgentRegistry;
import com.tierflow.core.graph.WorkflowGraph;
import com.tierflow.core.model.AgentHealth;
import com.tierflow.core.persistence.CheckpointStore;
import com.tierflow.core.scheduler.SchedulerCore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final WorkflowGraph workflowGraph;
    private final SchedulerCore scheduler;
    private final AgentRegistry agentRegistry;
    private final CheckpointStore checkpointStore;
    private final DataSource dataSource;

    public HealthCheckService(
            @Autowired(required = false) WorkflowGraph workflowGraph,
            @Autowired(required = false) SchedulerCore scheduler,
            @Autowired(required = false) AgentRegistry agentRegistry,
            @Autowired(required = false) CheckpointStore checkpointStore,
            @Autowired(required = false) DataSource dataSource) {
        this.workflowGraph = workflowGraph;
        this.scheduler = scheduler;
        this.agentRegistry = agentRegistry;
        this.checkpointStore = checkpointStore;
        this.dataSource = dataSource;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkGraph());
        results.add(checkScheduler());
        results.add(checkAgents());
        results.add(checkCheckpoints());
        if (dataSource != null) {
            results.add(checkDatabase());
        }
        return results;
    }

    /**
     * Worst status across all components.
     */
    public HealthStatus.Status overall() {
        return HealthStatus.worst(checkAll());
    }

    private HealthStatus checkGraph() {
        if (workflowGraph == null) {
            return HealthStatus.down("graph", "Workflow graph not available");
        }
        if (!workflowGraph.isValidated()) {
            return HealthStatus.degraded("graph",
                    "Workflow graph not validated", Map.of());
        }
        return HealthStatus.up("graph",
                "Workflow graph validated",
                Map.of("nodes", String.valueOf(workflowGraph.nodes().size()),
                        "entryPoints", String.join(",", workflowGraph.entryPoints())));
    }

    private HealthStatus checkScheduler() {
        if (scheduler == null) {
            return HealthStatus.down("scheduler", "Scheduler not available");
        }
        if (!scheduler.isRunning()) {
            return HealthStatus.down("scheduler", "Dispatch loop not running");
        }
        return HealthStatus.up("scheduler",
                "Dispatch loop running",
                Map.of("activeTasks", String.valueOf(scheduler.activeTaskCount())));
    }

    private HealthStatus checkAgents() {
        if (agentRegistry == null) {
            return HealthStatus.down("agents", "Agent registry not available");
        }
        Map<String, AgentHealth> health = agentRegistry.healthSnapshot();
        if (health.isEmpty()) {
            return HealthStatus.down("agents", "No agents registered");
        }
        var counts = new EnumMap<AgentHealth, Integer>(AgentHealth.class);
        health.values().forEach(h -> counts.merge(h, 1, Integer::sum));
        var metadata = new TreeMap<String, String>();
        health.forEach((id, h) -> metadata.put(id, h.name()));

        int healthy = counts.getOrDefault(AgentHealth.HEALTHY, 0);
        String detail = healthy + "/" + health.size() + " agents healthy";
        if (healthy == health.size()) {
            return HealthStatus.up("agents", detail, metadata);
        }
        if (counts.getOrDefault(AgentHealth.UNAVAILABLE, 0) == health.size()) {
            return new HealthStatus("agents", HealthStatus.Status.DOWN, detail, metadata);
        }
        return HealthStatus.degraded("agents", detail, metadata);
    }

    private HealthStatus checkCheckpoints() {
        if (checkpointStore == null) {
            return HealthStatus.down("checkpoints", "No CheckpointStore configured");
        }
        try {
            int tasks = checkpointStore.listTaskIds().size();
            return HealthStatus.up("checkpoints",
                    "Checkpoint store available (" + checkpointStore.getClass().getSimpleName() + ")",
                    Map.of("tasks", String.valueOf(tasks)));
        } catch (Exception e) {
            log.warn("Checkpoint store health check failed: {}", e.getMessage());
            return HealthStatus.down("checkpoints", "Checkpoint store error: " + e.getMessage());
        }
    }

    private HealthStatus checkDatabase() {
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return HealthStatus.up("database",
                        "Database connection valid", Map.of());
            }
            return HealthStatus.down("database", "Database connection invalid");
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return HealthStatus.down("database", "Database error: " + e.getMessage());
        }
    }
}
