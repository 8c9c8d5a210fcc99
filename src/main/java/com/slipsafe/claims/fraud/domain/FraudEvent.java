package com.slipsafe.claims.fraud.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * A recorded fraud incident. Published to the fraud-events topic and returned by the fraud API.
 */
@Value
@Builder
@Jacksonized
public class FraudEvent {

    String id;
    String claimId;
    String purchaseId;
    String userId;
    String merchantId;
    FraudEventType eventType;
    FraudSeverity severity;
    String description;
    /** Opaque context for investigators; never interpreted by the service. */
    String metadata;
    /** Audit row of the attempt that raised the event, when there was one. */
    String verificationId;
    boolean resolved;
    Instant resolvedAt;
    String resolvedBy;
    Instant createdAt;
}
