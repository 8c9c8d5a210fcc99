package com.slipsafe.claims.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Claim as shown to merchants and consumers. Never carries the PIN.
 */
@Value
@Builder
public class ClaimSummary {

    String claimId;
    String claimCode;
    ClaimType claimType;
    /** Effective state: EXPIRED when an open claim is past its deadline, even before any write. */
    ClaimState state;
    String merchantName;
    LocalDate purchaseDate;
    BigDecimal originalAmount;
    BigDecimal redeemedAmount;
    Instant expiresAt;
    Instant redeemedAt;
    boolean expired;
    boolean used;
}
