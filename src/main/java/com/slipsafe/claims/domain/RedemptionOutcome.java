package com.slipsafe.claims.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Result of a hold or redemption call. {@code newState} is the claim state after the call,
 * whether or not this call performed the transition.
 */
@Value
@Builder
public class RedemptionOutcome {

    String verificationId;
    VerificationStatus status;
    ClaimFailureCode failureCode;
    ClaimState newState;
    BigDecimal redeemedAmount;
    ClaimSummary claim;
    String message;
}
