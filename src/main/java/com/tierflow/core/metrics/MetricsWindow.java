package com.tierflow.core.metrics;

import java.time.Duration;

/**
 * Sliding-window spans metrics are aggregated over.
 */
public enum MetricsWindow {
    HOUR("1h", Duration.ofHours(1)),
    DAY("24h", Duration.ofHours(24)),
    WEEK("7d", Duration.ofDays(7));

    private final String label;
    private final Duration span;

    MetricsWindow(String label, Duration span) {
        this.label = label;
        this.span = span;
    }

    public String label() {
        return label;
    }

    public Duration span() {
        return span;
    }

    public static MetricsWindow fromLabel(String label) {
        for (MetricsWindow window : values()) {
            if (window.label.equalsIgnoreCase(label) || window.name().equalsIgnoreCase(label)) {
                return window;
            }
        }
        throw new IllegalArgumentException("Unknown metrics window: " + label);
    }
}
