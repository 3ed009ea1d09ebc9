package com.tierflow.core.metrics;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Time-bucketed ring buffer of outcome counts. A bucket is recycled the first time a
 * sample lands in it after its span has passed, so memory stays fixed regardless of volume.
 */
public class SlidingWindow {

    static final long[] DURATION_BOUNDS_MS = {100, 500, 1_000, 5_000, 30_000, 60_000};

    private final long bucketMillis;
    private final Bucket[] buckets;

    public SlidingWindow(Duration span, int bucketCount) {
        if (bucketCount <= 0) {
            throw new IllegalArgumentException("bucketCount must be > 0");
        }
        this.bucketMillis = Math.max(1, span.toMillis() / bucketCount);
        this.buckets = new Bucket[bucketCount];
        for (int i = 0; i < bucketCount; i++) {
            buckets[i] = new Bucket();
        }
    }

    public synchronized void record(Instant at, boolean success, long durationMs) {
        long index = at.toEpochMilli() / bucketMillis;
        Bucket bucket = buckets[(int) Math.floorMod(index, (long) buckets.length)];
        if (bucket.index != index) {
            bucket.reset(index);
        }
        bucket.total++;
        if (success) {
            bucket.successes++;
        } else {
            bucket.failures++;
        }
        bucket.durationSumMs += Math.max(0, durationMs);
        bucket.histogram[histogramSlot(durationMs)]++;
    }

    /**
     * Aggregates every bucket that still falls inside the window ending at {@code now}.
     */
    public synchronized AgentWindowStats stats(Instant now) {
        long current = now.toEpochMilli() / bucketMillis;
        long oldest = current - buckets.length + 1;
        long total = 0;
        long successes = 0;
        long failures = 0;
        long durationSum = 0;
        long[] histogram = new long[DURATION_BOUNDS_MS.length + 1];
        for (Bucket bucket : buckets) {
            if (bucket.index < oldest || bucket.index > current) {
                continue;
            }
            total += bucket.total;
            successes += bucket.successes;
            failures += bucket.failures;
            durationSum += bucket.durationSumMs;
            for (int i = 0; i < histogram.length; i++) {
                histogram[i] += bucket.histogram[i];
            }
        }
        if (total == 0) {
            return AgentWindowStats.EMPTY;
        }
        return new AgentWindowStats(total, successes, failures, (double) durationSum / total, labels(histogram));
    }

    /**
     * Length of one bucket; the window rolls over once per bucket.
     */
    public Duration bucketSpan() {
        return Duration.ofMillis(bucketMillis);
    }

    private static int histogramSlot(long durationMs) {
        for (int i = 0; i < DURATION_BOUNDS_MS.length; i++) {
            if (durationMs <= DURATION_BOUNDS_MS[i]) {
                return i;
            }
        }
        return DURATION_BOUNDS_MS.length;
    }

    private static Map<String, Long> labels(long[] histogram) {
        Map<String, Long> labelled = new LinkedHashMap<>();
        for (int i = 0; i < DURATION_BOUNDS_MS.length; i++) {
            labelled.put("le_" + DURATION_BOUNDS_MS[i] + "ms", histogram[i]);
        }
        labelled.put("gt_" + DURATION_BOUNDS_MS[DURATION_BOUNDS_MS.length - 1] + "ms", histogram[DURATION_BOUNDS_MS.length]);
        return labelled;
    }

    private static final class Bucket {
        long index = Long.MIN_VALUE;
        long total;
        long successes;
        long failures;
        long durationSumMs;
        final long[] histogram = new long[DURATION_BOUNDS_MS.length + 1];

        void reset(long newIndex) {
            index = newIndex;
            total = 0;
            successes = 0;
            failures = 0;
            durationSumMs = 0;
            Arrays.fill(histogram, 0);
        }
    }
}
