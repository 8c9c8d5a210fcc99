package com.slipsafe.claims.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Result of a read-only verification. {@code claim} and {@code purchase} are null when the claim
 * could not be identified.
 */
@Value
@Builder
public class VerificationOutcome {

    String verificationId;
    VerificationStatus status;
    ClaimFailureCode failureCode;
    ClaimSummary claim;
    Purchase purchase;
    ClaimComparison comparison;
    String message;

    public boolean isMatch() {
        return status == VerificationStatus.MATCH;
    }
}
