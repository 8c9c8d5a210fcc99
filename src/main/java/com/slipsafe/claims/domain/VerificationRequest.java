package com.slipsafe.claims.domain;

import lombok.Builder;
import lombok.Value;

/**
 * A point-of-sale verification attempt. Either the typed claim code or a scanned credential
 * (or both) must be present. Merchant fields are null for unauthenticated callers.
 */
@Value
@Builder(toBuilder = true)
public class VerificationRequest {

    String claimCode;
    String pin;
    /** Signed credential scanned from the QR code. */
    String credential;
    String merchantId;
    String merchantUserId;
    String clientIp;
    String userAgent;
    String notes;
}
