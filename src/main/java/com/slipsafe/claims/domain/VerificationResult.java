package com.slipsafe.claims.domain;

/**
 * Result recorded on every audit row of the verification trail.
 */
public enum VerificationResult {
    APPROVED,
    PARTIAL_APPROVED,
    REJECTED,
    FRAUD_SUSPECTED
}
