package com.tierflow.core.alerting;

import java.time.Instant;

/**
 * A raised alert.
 *
 * @param kind      what was breached
 * @param message   human-readable description
 * @param timestamp when the alert was raised
 * @param severity  severity
 * @param subject   agent id, task id or "system"
 * @param window    metrics window label for windowed alerts; null otherwise
 */
public record Alert(
    AlertKind kind,
    String message,
    Instant timestamp,
    AlertSeverity severity,
    String subject,
    String window
) {
}
