package com.slipsafe.claims.core.credential;

import com.slipsafe.claims.domain.ClaimType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Payload of the signed portable credential carried in the QR code. Contains no PIN and nothing
 * that would let the holder derive one.
 */
@Value
@Builder
public class ClaimCredential {

    String claimCode;
    String merchantName;
    LocalDate purchaseDate;
    BigDecimal amount;
    /** SHA-256 of merchant, date and amount; see {@link PurchaseFingerprint}. */
    String fingerprint;
    ClaimType claimType;
    Instant issuedAt;
    Instant expiresAt;
    /** True when the token's own expiry has passed; the stored claim still decides the outcome. */
    boolean tokenExpired;
}
