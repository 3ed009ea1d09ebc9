package com.tierflow.core.alerting;

public enum AlertSeverity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL
}
