package com.tierflow.core.agent;

import com.tierflow.config.TierflowProperties;
import com.tierflow.core.events.EventBus;
import com.tierflow.core.events.EventTypes;
import com.tierflow.core.events.OrchestrationEvent;
import com.tierflow.core.model.AgentHealth;
import com.tierflow.core.model.Tier;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Holds every agent known to the engine with its executor and health.
 * <p>
 * Health moves one level at a time: {@code failureThreshold} consecutive failures
 * (from probes or from call outcomes reported by the scheduler) step
 * HEALTHY → DEGRADED → UNAVAILABLE, and each success steps back a single level.
 * The registration and health maps are read-mostly and guarded by a read-write lock.
 */
@Service
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Registration> registrations = new LinkedHashMap<>();
    private final Map<String, HealthRecord> health = new LinkedHashMap<>();

    private final int failureThreshold;
    private final Map<String, String> substitutes;
    private final Duration healthCheckInterval;
    private final EventBus eventBus;
    private ScheduledExecutorService probeScheduler;

    @Autowired
    public AgentRegistry(TierflowProperties properties, EventBus eventBus) {
        this(properties.getRegistry().getFailureThreshold(),
                properties.getRegistry().getSubstitutes(),
                properties.getRegistry().getHealthCheckInterval(),
                eventBus);
    }

    public AgentRegistry(int failureThreshold, Map<String, String> substitutes,
                         Duration healthCheckInterval, EventBus eventBus) {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be > 0");
        }
        this.failureThreshold = failureThreshold;
        this.substitutes = substitutes == null ? Map.of() : Map.copyOf(substitutes);
        this.healthCheckInterval = healthCheckInterval;
        this.eventBus = eventBus;
    }

    @PostConstruct
    void startHealthChecks() {
        if (healthCheckInterval == null || healthCheckInterval.isZero() || healthCheckInterval.isNegative()) {
            log.info("Periodic agent health checks disabled");
            return;
        }
        probeScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "agent-health-probe");
            t.setDaemon(true);
            return t;
        });
        long intervalMs = healthCheckInterval.toMillis();
        probeScheduler.scheduleAtFixedRate(this::healthCheck, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Agent health checks started (interval={})", healthCheckInterval);
    }

    @PreDestroy
    void stopHealthChecks() {
        if (probeScheduler == null) {
            return;
        }
        probeScheduler.shutdown();
        try {
            if (!probeScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                probeScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            probeScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Agent health checks stopped");
    }

    public void register(AgentDescriptor descriptor, AgentExecutor executor) {
        register(descriptor, executor, AgentHealthProbe.ALWAYS_UP);
    }

    /**
     * Registers an agent. Agents start HEALTHY.
     *
     * @throws IllegalArgumentException if an agent with the same id is already registered
     */
    public void register(AgentDescriptor descriptor, AgentExecutor executor, AgentHealthProbe probe) {
        lock.writeLock().lock();
        try {
            if (registrations.containsKey(descriptor.id())) {
                throw new IllegalArgumentException("Agent already registered: " + descriptor.id());
            }
            registrations.put(descriptor.id(), new Registration(descriptor, executor,
                    probe != null ? probe : AgentHealthProbe.ALWAYS_UP));
            health.put(descriptor.id(), new HealthRecord());
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Registered agent {} [{}] capabilities={} concurrency={}",
                descriptor.id(), descriptor.tier(), descriptor.capabilityTags(), descriptor.concurrencyLimit());
    }

    /**
     * Resolves an executor for a capability, preferring an agent of exactly {@code tier},
     * then higher tiers, then lower ones; HEALTHY agents win over DEGRADED ones and
     * UNAVAILABLE agents are never returned. Falls back to the configured substitute tag.
     *
     * @throws AgentUnavailableException when neither the tag nor its substitute resolves
     */
    public ResolvedAgent resolve(String capabilityTag, Tier tier) {
        Optional<ResolvedAgent> primary = findCandidate(capabilityTag, tier, false);
        if (primary.isPresent()) {
            return primary.get();
        }
        String substitute = substitutes.get(capabilityTag);
        if (substitute != null) {
            Optional<ResolvedAgent> fallback = findCandidate(substitute, tier, true);
            if (fallback.isPresent()) {
                log.info("Capability '{}' unavailable; using substitute '{}' via agent {}",
                        capabilityTag, substitute, fallback.get().agentId());
                return fallback.get();
            }
        }
        throw new AgentUnavailableException(capabilityTag,
                "No available agent for capability '" + capabilityTag + "'"
                        + (substitute != null ? " or substitute '" + substitute + "'" : ""));
    }

    private Optional<ResolvedAgent> findCandidate(String capabilityTag, Tier tier, boolean substituted) {
        lock.readLock().lock();
        try {
            var candidates = new ArrayList<Registration>();
            for (var registration : registrations.values()) {
                if (registration.descriptor().hasCapability(capabilityTag)
                        && health.get(registration.descriptor().id()).level != AgentHealth.UNAVAILABLE) {
                    candidates.add(registration);
                }
            }
            return candidates.stream()
                    .min(Comparator.<Registration>comparingInt(r -> tierDistance(r.descriptor().tier(), tier))
                            .thenComparing(r -> health.get(r.descriptor().id()).level))
                    .map(r -> new ResolvedAgent(r.descriptor(), r.executor(),
                            health.get(r.descriptor().id()).level, substituted));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Exact match first, then higher tiers nearest-first, then lower tiers nearest-first.
     */
    private static int tierDistance(Tier agentTier, Tier wanted) {
        int diff = agentTier.ordinal() - wanted.ordinal();
        if (diff >= 0) {
            return diff * 2;
        }
        return -diff * 2 + 1;
    }

    /**
     * Probes every registered agent once and applies the results.
     *
     * @return health of every agent after the probe round
     */
    public Map<String, AgentHealth> healthCheck() {
        List<Registration> snapshot;
        lock.readLock().lock();
        try {
            snapshot = new ArrayList<>(registrations.values());
        } finally {
            lock.readLock().unlock();
        }
        for (var registration : snapshot) {
            String agentId = registration.descriptor().id();
            boolean up;
            try {
                up = registration.probe().probe();
            } catch (Exception e) {
                log.warn("Health probe for agent {} threw: {}", agentId, e.getMessage());
                up = false;
            }
            if (up) {
                recordSuccess(agentId);
            } else {
                recordFailure(agentId);
            }
        }
        return healthSnapshot();
    }

    /**
     * Records a successful call or probe: clears the failure streak and improves health one level.
     */
    public void recordSuccess(String agentId) {
        AgentHealth before;
        AgentHealth after;
        lock.writeLock().lock();
        try {
            HealthRecord record = health.get(agentId);
            if (record == null) {
                return;
            }
            before = record.level;
            record.consecutiveFailures = 0;
            record.level = before.better();
            after = record.level;
        } finally {
            lock.writeLock().unlock();
        }
        if (before != after) {
            onHealthChanged(agentId, before, after);
        }
    }

    /**
     * Records a failed call or probe; every {@code failureThreshold} consecutive failures
     * degrade health one level.
     */
    public void recordFailure(String agentId) {
        AgentHealth before;
        AgentHealth after;
        lock.writeLock().lock();
        try {
            HealthRecord record = health.get(agentId);
            if (record == null) {
                return;
            }
            before = record.level;
            record.consecutiveFailures++;
            if (record.consecutiveFailures >= failureThreshold) {
                record.level = before.worse();
                record.consecutiveFailures = 0;
            }
            after = record.level;
        } finally {
            lock.writeLock().unlock();
        }
        if (before != after) {
            onHealthChanged(agentId, before, after);
        }
    }

    public AgentHealth health(String agentId) {
        lock.readLock().lock();
        try {
            HealthRecord record = health.get(agentId);
            return record != null ? record.level : null;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Map<String, AgentHealth> healthSnapshot() {
        lock.readLock().lock();
        try {
            var result = new LinkedHashMap<String, AgentHealth>();
            health.forEach((id, record) -> result.put(id, record.level));
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<AgentDescriptor> descriptor(String agentId) {
        lock.readLock().lock();
        try {
            Registration registration = registrations.get(agentId);
            return Optional.ofNullable(registration).map(Registration::descriptor);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<AgentDescriptor> descriptors() {
        lock.readLock().lock();
        try {
            return registrations.values().stream().map(Registration::descriptor).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * True when at least one agent, of any health, advertises the capability or its substitute.
     */
    public boolean knowsCapability(String capabilityTag) {
        lock.readLock().lock();
        try {
            String substitute = substitutes.get(capabilityTag);
            return registrations.values().stream()
                    .anyMatch(r -> r.descriptor().hasCapability(capabilityTag)
                            || (substitute != null && r.descriptor().hasCapability(substitute)));
        } finally {
            lock.readLock().unlock();
        }
    }

    private void onHealthChanged(String agentId, AgentHealth before, AgentHealth after) {
        if (after.compareTo(before) > 0) {
            log.warn("Agent {} health degraded: {} -> {}", agentId, before, after);
        } else {
            log.info("Agent {} health recovered: {} -> {}", agentId, before, after);
        }
        if (eventBus != null) {
            eventBus.publish(new OrchestrationEvent(EventTypes.AGENT_HEALTH_CHANGED, null, null, agentId,
                    Map.of("from", before.name(), "to", after.name()), Instant.now()));
        }
    }

    private record Registration(AgentDescriptor descriptor, AgentExecutor executor, AgentHealthProbe probe) {}

    private static final class HealthRecord {
        private AgentHealth level = AgentHealth.HEALTHY;
        private int consecutiveFailures;
    }
}
