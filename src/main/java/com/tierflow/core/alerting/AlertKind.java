package com.tierflow.core.alerting;

/**
 * Kinds of alert the engine raises. Windowed kinds are evaluated on every metrics
 * window rollover; the rest are raised as soon as the triggering event is seen.
 */
public enum AlertKind {
    HIGH_CPU("high_cpu", AlertSeverity.WARNING, true),
    HIGH_MEMORY("high_memory", AlertSeverity.WARNING, true),
    HIGH_ERROR_RATE("high_error_rate", AlertSeverity.ERROR, true),
    LOW_SUCCESS_RATE("low_success_rate", AlertSeverity.WARNING, true),
    ESCALATION_EXHAUSTED("escalation_exhausted", AlertSeverity.CRITICAL, false),
    CHECKPOINT_FAILURE("checkpoint_failure", AlertSeverity.CRITICAL, false),
    SLA_BREACH("sla_breach", AlertSeverity.WARNING, false);

    private final String code;
    private final AlertSeverity defaultSeverity;
    private final boolean windowed;

    AlertKind(String code, AlertSeverity defaultSeverity, boolean windowed) {
        this.code = code;
        this.defaultSeverity = defaultSeverity;
        this.windowed = windowed;
    }

    public String code() {
        return code;
    }

    public AlertSeverity defaultSeverity() {
        return defaultSeverity;
    }

    public boolean windowed() {
        return windowed;
    }
}
