package com.slipsafe.claims.fraud.domain;

/**
 * Kinds of suspicious activity recorded against claims.
 */
public enum FraudEventType {
    /** Authentic credential whose payload does not describe the stored claim. */
    DUPLICATE_CLAIM_ATTEMPT,
    /** Redemption attempted after the claim's deadline. */
    EXPIRED_CLAIM_USE,
    /** PIN failure threshold reached within the trailing window. */
    INVALID_PIN_ATTEMPTS,
    /** Claim presented at a merchant other than the one the purchase was made at. */
    CROSS_MERCHANT_CLAIM,
    /** Flagged by staff or by a heuristic outside the fixed rules. */
    SUSPICIOUS_PATTERN
}
