package com.z254.sentinel.domain.model;

/**
 * Severity scale shared by anomalies, warnings and recommended actions.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }
}
