package com.slipsafe.claims.fraud.domain;

public enum FraudSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
