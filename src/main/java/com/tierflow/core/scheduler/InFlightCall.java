package com.tierflow.core.scheduler;

import com.tierflow.core.agent.AgentContext;
import com.tierflow.core.agent.AgentExecutor;
import com.tierflow.core.agent.AgentResult;
import com.tierflow.core.logging.MdcContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * One agent invocation running on an agent worker thread. Reports back exactly once
 * through {@code onFinished}, whatever the executor does.
 */
class InFlightCall implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(InFlightCall.class);

    /**
     * What the worker observed. {@code result} is null when the executor threw.
     */
    record Outcome(InFlightCall call, AgentResult result, Throwable error, long durationMs) {}

    private final String unitId;
    private final long attempt;
    private final String agentId;
    private final AgentExecutor executor;
    private final AgentContext context;
    private final Consumer<Outcome> onFinished;

    private Thread runner;

    InFlightCall(String unitId, long attempt, String agentId, AgentExecutor executor,
                 AgentContext context, Consumer<Outcome> onFinished) {
        this.unitId = unitId;
        this.attempt = attempt;
        this.agentId = agentId;
        this.executor = executor;
        this.context = context;
        this.onFinished = onFinished;
    }

    @Override
    public void run() {
        synchronized (this) {
            runner = Thread.currentThread();
        }
        MdcContext.setNode(context.taskId(), context.nodeId(), agentId);
        long startNanos = System.nanoTime();
        AgentResult result = null;
        Throwable error = null;
        try {
            if (context.isCancelled()) {
                error = new InterruptedException("cancelled before start: " + context.cancellation().reason());
            } else {
                result = executor.process(context);
                if (result == null) {
                    error = new IllegalStateException("agent returned no result");
                }
            }
        } catch (Throwable t) {
            // Errors included: the worker slot is released only through onFinished
            error = t;
        } finally {
            synchronized (this) {
                runner = null;
            }
            // interrupt aimed at this call must not leak into the next task on this thread
            Thread.interrupted();
            MdcContext.clear();
        }
        long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
        if (error instanceof Error) {
            log.warn("Agent {} raised {} on {}@{}", agentId, error, unitId, context.nodeId(), error);
        } else if (error != null) {
            log.debug("Agent {} failed on {}@{}: {}", agentId, unitId, context.nodeId(), error.toString());
        }
        onFinished.accept(new Outcome(this, result, error, durationMs));
    }

    /**
     * Raises the cooperative flag and interrupts the worker if the call is running.
     */
    void cancel(String reason) {
        context.cancellation().cancel(reason);
        synchronized (this) {
            if (runner != null) {
                runner.interrupt();
            }
        }
    }

    String unitId() {
        return unitId;
    }

    long attempt() {
        return attempt;
    }

    String agentId() {
        return agentId;
    }

    String nodeId() {
        return context.nodeId();
    }
}
