package com.slipsafe.claims.fraud.domain;

import lombok.Builder;
import lombok.Value;

/**
 * One detected signal on an attempt, before it is persisted as a {@link FraudEvent}.
 */
@Value
@Builder
public class FraudSignal {

    FraudEventType type;
    FraudSeverity severity;
    String description;
    String metadata;

    /** Whether this signal marks the attempt itself as suspected fraud in the audit log. */
    public boolean marksAttemptSuspect() {
        return type == FraudEventType.DUPLICATE_CLAIM_ATTEMPT
                || type == FraudEventType.INVALID_PIN_ATTEMPTS
                || type == FraudEventType.SUSPICIOUS_PATTERN;
    }
}
