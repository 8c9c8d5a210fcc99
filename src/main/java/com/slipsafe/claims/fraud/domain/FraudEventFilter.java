package com.slipsafe.claims.fraud.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Optional criteria for listing fraud events; null fields match everything.
 */
@Value
@Builder
public class FraudEventFilter {

    FraudEventType eventType;
    FraudSeverity severity;
    Boolean resolved;
    String claimId;
    String merchantId;
    Instant createdSince;
}
