package com.tierflow.core.model;

/**
 * Hierarchy level that owns a task. Ordered: escalation only ever moves a task
 * to a later constant, except through an explicit reset.
 */
public enum Tier {
    OPERATIONAL,
    MANAGEMENT,
    EXECUTIVE;

    /**
     * Returns the next tier up, or {@code null} when already at the top.
     */
    public Tier next() {
        return switch (this) {
            case OPERATIONAL -> MANAGEMENT;
            case MANAGEMENT -> EXECUTIVE;
            case EXECUTIVE -> null;
        };
    }

    public boolean isHighest() {
        return this == EXECUTIVE;
    }

    public boolean isAbove(Tier other) {
        return compareTo(other) > 0;
    }
}
