package com.guardian.backend.model;

/**
 * Severity of a position or of the whole portfolio. Declaration order is the severity order.
 */
public enum RiskLevel {
    LOW,
    MODERATE,
    HIGH,
    CRITICAL;

    public boolean isAtLeast(RiskLevel other) {
        return compareTo(other) >= 0;
    }
}
