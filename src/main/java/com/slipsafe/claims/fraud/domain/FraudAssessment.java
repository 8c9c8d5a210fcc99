package com.slipsafe.claims.fraud.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Signals raised for one attempt. Produced before the audit row is written so the row's result can
 * reflect suspicion; persisted afterwards so events can reference the row.
 */
@Value
@Builder
public class FraudAssessment {

    FraudAttempt attempt;
    @Singular
    List<FraudSignal> signals;

    public boolean isSuspected() {
        return signals.stream().anyMatch(FraudSignal::marksAttemptSuspect);
    }

    public boolean isEmpty() {
        return signals.isEmpty();
    }

    public static FraudAssessment none(FraudAttempt attempt) {
        return FraudAssessment.builder().attempt(attempt).build();
    }
}
