package com.tierflow.core.agent;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag handed to agents. The scheduler sets it on timeout,
 * explicit cancel, or sibling-branch failure; agents are expected to poll it.
 */
public final class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private volatile String reason;

    public void cancel(String reason) {
        if (cancelled.compareAndSet(false, true)) {
            this.reason = reason;
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public String reason() {
        return reason;
    }
}
