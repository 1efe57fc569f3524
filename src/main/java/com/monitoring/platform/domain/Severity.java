package com.monitoring.platform.domain;

/**
 * Severity of an anomaly or notification, lowest first. Drives channel fan-out
 * (higher severity reaches more channels) and throttling (CRITICAL is never throttled).
 * INFO is reserved for operator-triggered test alerts.
 */
public enum Severity {
    INFO,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    /**
     * Band a 0.0–1.0 indicator: &ge;0.8 CRITICAL, &ge;0.6 HIGH, &ge;0.4 MEDIUM, else LOW.
     */
    public static Severity fromIndicator(double indicator) {
        return indicator >= 0.8 ? CRITICAL : indicator >= 0.6 ? HIGH : indicator >= 0.4 ? MEDIUM : LOW;
    }
}
