package com.tierflow.core.scheduler;

import com.tierflow.config.TierflowProperties;

import java.time.Duration;

/**
 * Exponential backoff between retries of a transiently failed node:
 * {@code base * factor^(retry-1)}, capped at {@code max}.
 */
public class BackoffPolicy {

    private final Duration base;
    private final double factor;
    private final Duration max;

    public BackoffPolicy(Duration base, double factor, Duration max) {
        if (base.isNegative() || max.isNegative()) {
            throw new IllegalArgumentException("backoff durations must not be negative");
        }
        if (factor < 1.0) {
            throw new IllegalArgumentException("backoff factor must be >= 1");
        }
        this.base = base;
        this.factor = factor;
        this.max = max;
    }

    public static BackoffPolicy from(TierflowProperties.Scheduler scheduler) {
        return new BackoffPolicy(scheduler.getBackoffBase(), scheduler.getBackoffFactor(), scheduler.getBackoffMax());
    }

    /**
     * Delay before the given retry.
     *
     * @param retry 1 for the first retry
     */
    public Duration delayFor(int retry) {
        if (retry < 1) {
            throw new IllegalArgumentException("retry must be >= 1");
        }
        double millis = base.toMillis() * Math.pow(factor, retry - 1);
        if (Double.isInfinite(millis) || millis >= max.toMillis()) {
            return max;
        }
        return Duration.ofMillis((long) millis);
    }

    public Duration base() {
        return base;
    }

    public double factor() {
        return factor;
    }

    public Duration max() {
        return max;
    }
}
