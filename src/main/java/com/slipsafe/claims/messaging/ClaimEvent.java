package com.slipsafe.claims.messaging;

import com.slipsafe.claims.domain.ClaimState;
import com.slipsafe.claims.domain.ClaimType;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Claim lifecycle event published to Kafka. Carries no PIN and no credential.
 */
@Value
@Builder
@Jacksonized
public class ClaimEvent {

    String eventId;
    /** CLAIM_ISSUED, CLAIM_HELD, CLAIM_REDEEMED, CLAIM_PARTIALLY_REDEEMED, CLAIM_REFUSED, CLAIM_EXPIRED */
    String eventType;
    String claimId;
    String claimCode;
    String purchaseId;
    String userId;
    ClaimType claimType;
    ClaimState state;
    BigDecimal originalAmount;
    BigDecimal redeemedAmount;
    String merchantId;
    String merchantUserId;
    Instant expiresAt;
    Instant timestamp;
}
