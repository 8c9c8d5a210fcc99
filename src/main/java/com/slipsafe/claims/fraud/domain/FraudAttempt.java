package com.slipsafe.claims.fraud.domain;

import com.slipsafe.claims.domain.AttemptType;
import com.slipsafe.claims.domain.ClaimFailureCode;
import com.slipsafe.claims.domain.VerificationStatus;
import lombok.Builder;
import lombok.Value;

/**
 * What the fraud detector needs to know about a verification, hold or redemption attempt.
 * Claim fields are null when the attempted code matched nothing.
 */
@Value
@Builder
public class FraudAttempt {

    AttemptType attemptType;
    String attemptedClaimCode;
    String claimId;
    String purchaseId;
    String userId;
    String originMerchantId;
    String merchantId;
    VerificationStatus status;
    ClaimFailureCode failureCode;
}
