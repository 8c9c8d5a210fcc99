package com.slipsafe.claims.core;

import com.slipsafe.claims.core.credential.ClaimCredential;
import com.slipsafe.claims.domain.ClaimComparison;
import com.slipsafe.claims.domain.ClaimFailureCode;
import com.slipsafe.claims.domain.Purchase;
import com.slipsafe.claims.domain.VerificationStatus;
import com.slipsafe.claims.persistence.entity.ClaimEntity;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of the read-only verification checks, before anything is written.
 */
@Value
@Builder
class Evaluation {

    String attemptedClaimCode;
    /** Null when no claim could be identified. */
    ClaimEntity claim;
    /** Null when the purchase is unknown to the ledger or the PIN was not confirmed. */
    Purchase purchase;
    ClaimCredential credential;
    VerificationStatus status;
    ClaimFailureCode failureCode;
    /** Null when the PIN was never compared. */
    Boolean pinCorrect;
    ClaimComparison comparison;
    String message;

    boolean isMatch() {
        return status == VerificationStatus.MATCH;
    }
}
