package com.slipsafe.claims.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Merchant request to settle a claim: full or partial redemption, or an explicit refusal.
 */
@Value
@Builder
public class RedemptionRequest {

    String claimCode;
    String pin;
    String credential;
    /** Amount to refund. Required for partial redemptions; optional (must equal the original) otherwise. */
    BigDecimal refundAmount;
    boolean partial;
    /** Staff declines the claim after a technical match. */
    boolean refuse;
    String notes;
    String merchantId;
    String merchantUserId;
    String clientIp;
    String userAgent;

    public VerificationRequest toVerificationRequest() {
        return VerificationRequest.builder()
                .claimCode(claimCode)
                .pin(pin)
                .credential(credential)
                .merchantId(merchantId)
                .merchantUserId(merchantUserId)
                .clientIp(clientIp)
                .userAgent(userAgent)
                .notes(notes)
                .build();
    }
}
