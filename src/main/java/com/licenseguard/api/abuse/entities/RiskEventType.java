package com.licenseguard.api.abuse.entities;

/**
 * Closed set of abuse-relevant events recorded in the {@code risk_events} table.
 */
public enum RiskEventType {
    DEVICE_CAP_EXCEEDED,
    DEVICE_CREATION_RATE_LIMIT,
    DEVICE_CHURN_DETECTED,
    RAPID_DEVICE_CREATION,
    RECONCILIATION_PERFORMED,
    SUSPICIOUS_PATTERN,
}
