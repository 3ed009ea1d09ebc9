package com.tierflow.core.metrics;

import com.tierflow.config.TierflowProperties;
import com.tierflow.core.events.EventBus;
import com.tierflow.core.events.EventFilter;
import com.tierflow.core.events.EventTypes;
import com.tierflow.core.events.OrchestrationEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Aggregates scheduler events into sliding windows (1h / 24h / 7d) per agent and
 * system-wide, plus externally fed CPU / memory samples and HTTP request outcomes.
 * <p>
 * Each window rolls over once per bucket span; listeners (the alert engine) are handed a
 * fresh snapshot of every window that rolled over.
 */
@Service
public class MetricsCollector {

    private static final Logger log = LoggerFactory.getLogger(MetricsCollector.class);

    /**
     * Notified with the snapshot of a window that just rolled over.
     */
    @FunctionalInterface
    public interface RolloverListener {
        void onRollover(MetricsWindow window, MetricsSnapshot snapshot);
    }

    private final EventBus eventBus;
    private final int bucketsPerWindow;
    private final Duration rolloverInterval;
    private final Clock clock;

    private final Map<String, EnumMap<MetricsWindow, SlidingWindow>> agentWindows = new ConcurrentHashMap<>();
    private final EnumMap<MetricsWindow, SlidingWindow> taskWindows;
    private final EnumMap<MetricsWindow, SlidingWindow> httpWindows;
    private final EnumMap<MetricsWindow, Long> lastRollover = new EnumMap<>(MetricsWindow.class);
    private final List<RolloverListener> listeners = new CopyOnWriteArrayList<>();

    private volatile MetricsSnapshot.SystemSample latestSystemSample;
    private EventBus.Subscription subscription;
    private ScheduledExecutorService rolloverScheduler;

    @Autowired
    public MetricsCollector(TierflowProperties properties, EventBus eventBus) {
        this(eventBus, properties.getMetrics().getBucketsPerWindow(),
                properties.getMetrics().getRolloverInterval(), Clock.systemUTC());
    }

    public MetricsCollector(EventBus eventBus, int bucketsPerWindow, Duration rolloverInterval, Clock clock) {
        if (bucketsPerWindow <= 0) {
            throw new IllegalArgumentException("bucketsPerWindow must be > 0");
        }
        this.eventBus = eventBus;
        this.bucketsPerWindow = bucketsPerWindow;
        this.rolloverInterval = rolloverInterval;
        this.clock = clock;
        this.taskWindows = newWindows();
        this.httpWindows = newWindows();
        Instant now = clock.instant();
        for (MetricsWindow window : MetricsWindow.values()) {
            lastRollover.put(window, periodIndex(window, now));
        }
    }

    @PostConstruct
    public void start() {
        subscription = eventBus.subscribe(
                EventFilter.ofTypes(EventTypes.NODE_COMPLETED, EventTypes.NODE_TIMED_OUT,
                        EventTypes.TASK_SUCCEEDED, EventTypes.TASK_FAILED),
                this::onEvent);
        if (rolloverInterval == null || rolloverInterval.isZero() || rolloverInterval.isNegative()) {
            log.info("Metrics rollover timer disabled");
            return;
        }
        rolloverScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "metrics-rollover");
            t.setDaemon(true);
            return t;
        });
        long intervalMs = rolloverInterval.toMillis();
        rolloverScheduler.scheduleAtFixedRate(() -> {
            try {
                tick(clock.instant());
            } catch (RuntimeException e) {
                log.warn("Metrics rollover failed: {}", e.getMessage(), e);
            }
        }, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Metrics collector started ({} buckets per window, tick every {})", bucketsPerWindow, rolloverInterval);
    }

    @PreDestroy
    public void stop() {
        if (subscription != null) {
            subscription.unsubscribe();
            subscription = null;
        }
        if (rolloverScheduler != null) {
            rolloverScheduler.shutdownNow();
            rolloverScheduler = null;
        }
    }

    public void addRolloverListener(RolloverListener listener) {
        listeners.add(listener);
    }

    // -- Feeds -----------------------------------------------------------------

    public void recordAgentTask(String agentId, boolean success, long durationMs, Instant at) {
        agentWindows.computeIfAbsent(agentId, id -> newWindows())
                .values()
                .forEach(window -> window.record(at, success, durationMs));
    }

    public void recordTaskOutcome(boolean success, long durationMs, Instant at) {
        taskWindows.values().forEach(window -> window.record(at, success, durationMs));
    }

    /**
     * Records one HTTP request served by an outer layer; status codes >= 400 count as errors.
     */
    public void recordHttpRequest(int statusCode, long durationMs) {
        Instant now = clock.instant();
        httpWindows.values().forEach(window -> window.record(now, statusCode < 400, durationMs));
    }

    public void recordSystemSample(double cpuPercent, double memoryPercent) {
        latestSystemSample = new MetricsSnapshot.SystemSample(cpuPercent, memoryPercent, clock.instant());
    }

    private void onEvent(OrchestrationEvent event) {
        switch (event.eventType()) {
            case EventTypes.NODE_COMPLETED -> {
                if (event.agentId() != null) {
                    recordAgentTask(event.agentId(), Boolean.TRUE.equals(event.get("succeeded")),
                            longField(event, "durationMs"), event.timestamp());
                }
            }
            case EventTypes.NODE_TIMED_OUT -> {
                if (event.agentId() != null) {
                    recordAgentTask(event.agentId(), false, longField(event, "timeoutMs"), event.timestamp());
                }
            }
            case EventTypes.TASK_SUCCEEDED -> recordTaskOutcome(true, longField(event, "durationMs"), event.timestamp());
            case EventTypes.TASK_FAILED -> recordTaskOutcome(false, longField(event, "durationMs"), event.timestamp());
            default -> {
                // not aggregated
            }
        }
    }

    private static long longField(OrchestrationEvent event, String key) {
        Object value = event.get(key);
        return value instanceof Number n ? n.longValue() : 0L;
    }

    // -- Queries ---------------------------------------------------------------

    public AgentWindowStats agentStats(String agentId, MetricsWindow window) {
        var windows = agentWindows.get(agentId);
        return windows == null ? AgentWindowStats.EMPTY : windows.get(window).stats(clock.instant());
    }

    /**
     * Agents with at least one task in the window, best performance score first; ties go to
     * the lower average duration.
     */
    public List<MetricsSnapshot.AgentRanking> topAgents(MetricsWindow window, int limit) {
        return rank(agentStatsFor(window, clock.instant()), limit);
    }

    public MetricsSnapshot snapshot(MetricsWindow window) {
        return snapshot(window, clock.instant());
    }

    public MetricsSnapshot snapshot(MetricsWindow window, Instant now) {
        Map<String, AgentWindowStats> agents = agentStatsFor(window, now);
        return new MetricsSnapshot(window.label(), now, agents,
                taskWindows.get(window).stats(now),
                httpWindows.get(window).stats(now),
                latestSystemSample,
                rank(agents, 5),
                List.of(),
                null);
    }

    /**
     * Advances the rollover clock: every window whose bucket boundary was crossed since
     * the previous tick is handed to the listeners.
     */
    public synchronized void tick(Instant now) {
        for (MetricsWindow window : MetricsWindow.values()) {
            long period = periodIndex(window, now);
            Long previous = lastRollover.get(window);
            if (previous != null && period <= previous) {
                continue;
            }
            lastRollover.put(window, period);
            MetricsSnapshot snapshot = snapshot(window, now);
            log.debug("Window {} rolled over", window.label());
            for (RolloverListener listener : listeners) {
                try {
                    listener.onRollover(window, snapshot);
                } catch (RuntimeException e) {
                    log.warn("Rollover listener threw: {}", e.getMessage(), e);
                }
            }
        }
    }

    private Map<String, AgentWindowStats> agentStatsFor(MetricsWindow window, Instant now) {
        Map<String, AgentWindowStats> stats = new TreeMap<>();
        agentWindows.forEach((agentId, windows) -> {
            AgentWindowStats s = windows.get(window).stats(now);
            if (s.total() > 0) {
                stats.put(agentId, s);
            }
        });
        return stats;
    }

    private static List<MetricsSnapshot.AgentRanking> rank(Map<String, AgentWindowStats> stats, int limit) {
        return stats.entrySet().stream()
                .map(e -> new MetricsSnapshot.AgentRanking(e.getKey(), e.getValue().performanceScore(),
                        e.getValue().successRate(), e.getValue().total(), e.getValue().avgDurationMs()))
                .sorted(Comparator.comparingDouble(MetricsSnapshot.AgentRanking::performanceScore).reversed()
                        .thenComparingDouble(MetricsSnapshot.AgentRanking::avgDurationMs)
                        .thenComparing(MetricsSnapshot.AgentRanking::agentId))
                .limit(limit)
                .toList();
    }

    private long periodIndex(MetricsWindow window, Instant now) {
        long bucketMillis = Math.max(1, window.span().toMillis() / bucketsPerWindow);
        return now.toEpochMilli() / bucketMillis;
    }

    private EnumMap<MetricsWindow, SlidingWindow> newWindows() {
        var windows = new EnumMap<MetricsWindow, SlidingWindow>(MetricsWindow.class);
        for (MetricsWindow window : MetricsWindow.values()) {
            windows.put(window, new SlidingWindow(window.span(), bucketsPerWindow));
        }
        return windows;
    }
}
