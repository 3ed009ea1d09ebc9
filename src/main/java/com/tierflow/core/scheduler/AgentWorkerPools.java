package com.tierflow.core.scheduler;

import com.tierflow.core.agent.AgentDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One bounded worker pool per agent, sized to the agent's concurrency limit, plus the
 * in-flight counters the dispatch loop checks before handing out work.
 * <p>
 * A slot is taken at dispatch and given back only when the worker has actually returned,
 * so a timed-out call that ignores cancellation keeps occupying its slot.
 */
class AgentWorkerPools {

    private static final Logger log = LoggerFactory.getLogger(AgentWorkerPools.class);

    private final Map<String, ExecutorService> pools = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> inFlight = new ConcurrentHashMap<>();

    /**
     * Takes a slot for the agent if one is free.
     */
    boolean tryAcquire(AgentDescriptor agent) {
        AtomicInteger counter = inFlight.computeIfAbsent(agent.id(), id -> new AtomicInteger());
        while (true) {
            int current = counter.get();
            if (current >= agent.concurrencyLimit()) {
                return false;
            }
            if (counter.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    void release(String agentId) {
        AtomicInteger counter = inFlight.get(agentId);
        if (counter == null || counter.getAndUpdate(v -> Math.max(0, v - 1)) == 0) {
            log.warn("Released a slot of agent {} that held none", agentId);
        }
    }

    int inFlight(String agentId) {
        AtomicInteger counter = inFlight.get(agentId);
        return counter == null ? 0 : counter.get();
    }

    /**
     * Runs a call on the agent's pool. The caller must hold a slot.
     */
    void execute(AgentDescriptor agent, Runnable call) {
        pools.computeIfAbsent(agent.id(), id -> Executors.newFixedThreadPool(agent.concurrencyLimit(), r -> {
            Thread t = new Thread(r, "agent-" + id);
            t.setDaemon(true);
            return t;
        })).execute(call);
    }

    void shutdown() {
        pools.forEach((agentId, pool) -> {
            pool.shutdownNow();
            try {
                if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Worker pool of agent {} did not terminate in time", agentId);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        pools.clear();
    }
}
