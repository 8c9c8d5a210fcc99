package com.slipsafe.claims.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Everything the consumer needs to present a claim: code, PIN and the scannable payload.
 */
@Value
@Builder
public class IssuedClaim {

    String claimId;
    String claimCode;
    String pin;
    /** Verifier URL embedding the signed credential; rendered as a QR code by the client. */
    String qrPayload;
    /** Signed credential on its own, for clients that build their own QR payload. */
    String credential;
    Instant expiresAt;
    ClaimType claimType;
    ClaimState state;
    /** True when an existing open claim was returned instead of minting a new one. */
    boolean reused;
}
