package com.slipsafe.claims.domain;

/**
 * Status shown to merchant staff at the point of sale. Always explicit, never a bare error.
 */
public enum VerificationStatus {
    MATCH,
    NO_MATCH,
    EXPIRED,
    ALREADY_REDEEMED,
    INVALID,
    RATE_LIMITED
}
