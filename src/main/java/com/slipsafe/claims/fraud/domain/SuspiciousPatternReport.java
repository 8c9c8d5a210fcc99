package com.slipsafe.claims.fraud.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Caller-supplied report of activity that fits no dedicated fraud event type.
 */
@Value
@Builder
public class SuspiciousPatternReport {

    String claimId;
    String purchaseId;
    String userId;
    String merchantId;
    /** Defaults to LOW when absent. */
    FraudSeverity severity;
    String description;
    String metadata;
}
