package com.tierflow.core.alerting;

import com.tierflow.config.TierflowProperties;
import com.tierflow.core.events.EventBus;
import com.tierflow.core.events.EventFilter;
import com.tierflow.core.events.EventTypes;
import com.tierflow.core.events.OrchestrationEvent;
import com.tierflow.core.metrics.AgentWindowStats;
import com.tierflow.core.metrics.MetricsCollector;
import com.tierflow.core.metrics.MetricsSnapshot;
import com.tierflow.core.metrics.MetricsWindow;
import com.tierflow.core.metrics.OrchestrationMetrics;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Raises threshold alerts.
 * <p>
 * Windowed checks (CPU, memory, HTTP error rate, per-agent success rate) run on every
 * metrics window rollover, and every breach alerts again on the next rollover while it
 * persists. Escalation exhaustion, checkpoint failures and SLA breaches alert as soon
 * as the scheduler reports them.
 */
@Service
public class AlertEngine implements MetricsCollector.RolloverListener {

    private static final Logger log = LoggerFactory.getLogger(AlertEngine.class);

    private final EventBus eventBus;
    private final OrchestrationMetrics metrics;
    private final Clock clock;
    private final double cpuPercent;
    private final double memoryPercent;
    private final double httpErrorRate;
    private final double agentSuccessRate;
    private final int historyLimit;

    private final Deque<Alert> history = new ArrayDeque<>();
    private EventBus.Subscription subscription;

    @Autowired
    public AlertEngine(TierflowProperties properties, MetricsCollector collector, EventBus eventBus,
                       OrchestrationMetrics metrics) {
        this(collector, eventBus, metrics, Clock.systemUTC(),
                properties.getAlerting().getCpuPercent(),
                properties.getAlerting().getMemoryPercent(),
                properties.getAlerting().getHttpErrorRate(),
                properties.getAlerting().getAgentSuccessRate(),
                properties.getAlerting().getHistoryLimit());
    }

    public AlertEngine(MetricsCollector collector, EventBus eventBus, OrchestrationMetrics metrics, Clock clock,
                       double cpuPercent, double memoryPercent, double httpErrorRate,
                       double agentSuccessRate, int historyLimit) {
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
        this.cpuPercent = cpuPercent;
        this.memoryPercent = memoryPercent;
        this.httpErrorRate = httpErrorRate;
        this.agentSuccessRate = agentSuccessRate;
        this.historyLimit = Math.max(1, historyLimit);
        if (collector != null) {
            collector.addRolloverListener(this);
        }
    }

    @PostConstruct
    public void start() {
        subscription = eventBus.subscribe(
                EventFilter.ofTypes(EventTypes.TASK_SUCCEEDED, EventTypes.TASK_FAILED, EventTypes.CHECKPOINT_FAILED),
                this::onEvent);
    }

    @PreDestroy
    public void stop() {
        if (subscription != null) {
            subscription.unsubscribe();
            subscription = null;
        }
    }

    @Override
    public void onRollover(MetricsWindow window, MetricsSnapshot snapshot) {
        evaluate(snapshot);
    }

    /**
     * Evaluates the windowed thresholds against one window snapshot.
     *
     * @return the alerts raised
     */
    public List<Alert> evaluate(MetricsSnapshot snapshot) {
        var raised = new ArrayList<Alert>();
        String window = snapshot.window();

        MetricsSnapshot.SystemSample system = snapshot.system();
        if (system != null) {
            if (system.cpuPercent() > cpuPercent) {
                raised.add(raise(AlertKind.HIGH_CPU, "High CPU usage: " + percent(system.cpuPercent()) + "%",
                        "system", window));
            }
            if (system.memoryPercent() > memoryPercent) {
                raised.add(raise(AlertKind.HIGH_MEMORY, "High memory usage: " + percent(system.memoryPercent()) + "%",
                        "system", window));
            }
        }

        AgentWindowStats http = snapshot.http();
        if (http != null && http.total() > 0 && http.failureRate() > httpErrorRate) {
            raised.add(raise(AlertKind.HIGH_ERROR_RATE,
                    "High error rate: " + percent(http.failureRate() * 100) + "% over " + window,
                    "system", window));
        }

        for (Map.Entry<String, AgentWindowStats> entry : snapshot.agents().entrySet()) {
            AgentWindowStats stats = entry.getValue();
            if (stats.total() > 0 && stats.successRate() < agentSuccessRate) {
                raised.add(raise(AlertKind.LOW_SUCCESS_RATE,
                        "Low success rate for agent " + entry.getKey() + ": " + percent(stats.successRate() * 100)
                                + "% over " + window + " (" + stats.total() + " tasks)",
                        entry.getKey(), window));
            }
        }
        return raised;
    }

    private void onEvent(OrchestrationEvent event) {
        if (EventTypes.CHECKPOINT_FAILED.equals(event.eventType())) {
            raise(AlertKind.CHECKPOINT_FAILURE, "Checkpoint write failed for task " + event.taskId()
                    + ": " + event.get("error"), event.taskId(), null);
            return;
        }
        if (Boolean.TRUE.equals(event.get("escalationExhausted"))) {
            raise(AlertKind.ESCALATION_EXHAUSTED, "Escalation refused for task " + event.taskId()
                    + ": " + event.get("reason"), event.taskId(), null);
        }
        if (Boolean.TRUE.equals(event.get("slaBreached"))) {
            raise(AlertKind.SLA_BREACH, "Task " + event.taskId() + " (" + event.get("priority")
                    + ") finished after its SLA deadline " + event.get("slaDeadline"), event.taskId(), null);
        }
    }

    private Alert raise(AlertKind kind, String message, String subject, String window) {
        var alert = new Alert(kind, message, clock.instant(), kind.defaultSeverity(), subject, window);
        synchronized (history) {
            history.addLast(alert);
            while (history.size() > historyLimit) {
                history.removeFirst();
            }
        }
        if (alert.severity() == AlertSeverity.CRITICAL || alert.severity() == AlertSeverity.ERROR) {
            log.error("[{}] {}", kind.code(), message);
        } else {
            log.warn("[{}] {}", kind.code(), message);
        }
        if (metrics != null) {
            metrics.recordAlert(kind.code(), alert.severity().name());
        }
        // windowed alerts concern an agent or the system, immediate ones a task
        String taskId = window == null ? subject : null;
        eventBus.publish(new OrchestrationEvent(EventTypes.ALERT_RAISED, taskId, null, null, Map.of(
                "kind", kind.code(),
                "severity", alert.severity().name(),
                "subject", subject,
                "message", message), alert.timestamp()));
        return alert;
    }

    /**
     * Alerts raised so far, oldest first, bounded by the configured history limit.
     */
    public List<Alert> alerts() {
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    public List<Alert> alerts(AlertKind kind) {
        return alerts().stream().filter(a -> a.kind() == kind).toList();
    }

    public void clear() {
        synchronized (history) {
            history.clear();
        }
    }

    private static String percent(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
