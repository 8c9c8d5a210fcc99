package com.slipsafe.claims.fraud.engine;

import com.slipsafe.claims.api.FraudEventNotFoundException;
import com.slipsafe.claims.domain.AttemptType;
import com.slipsafe.claims.domain.ClaimFailureCode;
import com.slipsafe.claims.domain.VerificationStatus;
import com.slipsafe.claims.fraud.domain.FraudAssessment;
import com.slipsafe.claims.fraud.domain.FraudAttempt;
import com.slipsafe.claims.fraud.domain.FraudEvent;
import com.slipsafe.claims.fraud.domain.FraudEventFilter;
import com.slipsafe.claims.fraud.domain.FraudEventType;
import com.slipsafe.claims.fraud.domain.FraudSeverity;
import com.slipsafe.claims.fraud.domain.FraudSignal;
import com.slipsafe.claims.fraud.domain.SuspiciousPatternReport;
import com.slipsafe.claims.fraud.messaging.FraudEventProducer;
import com.slipsafe.claims.persistence.service.FraudEventPersistenceService;
import com.slipsafe.claims.persistence.service.VerificationAuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Rule-based fraud detection over the verification audit log. Invoked synchronously by the verifier
 * and redeemer: {@link #assess} before an attempt's audit row is written, {@link #record} right after.
 * PIN throttling is computed from the audit table so it holds across restarts and instances.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FraudDetector {

    private final VerificationAuditService auditService;
    private final FraudEventPersistenceService persistenceService;
    private final FraudEventProducer fraudEventProducer;
    private final Clock clock;

    @Value("${claims.fraud.pin-failure-threshold:5}")
    private int pinFailureThreshold;
    @Value("${claims.fraud.pin-failure-window-minutes:15}")
    private int pinFailureWindowMinutes;

    public long countFailedPinAttempts(String claimId, int windowMinutes) {
        Instant since = clock.instant().minus(Duration.ofMinutes(windowMinutes));
        return auditService.countFailedPinAttemptsSince(claimId, since);
    }

    /** True once the claim has reached the failed-PIN threshold within the configured window. */
    public boolean isPinThrottled(String claimId) {
        long failures = countFailedPinAttempts(claimId, pinFailureWindowMinutes);
        if (failures >= pinFailureThreshold) {
            log.warn("PIN attempts throttled: claimId={} failures={} windowMinutes={}",
                    claimId, failures, pinFailureWindowMinutes);
            return true;
        }
        return false;
    }

    /**
     * Classifies an attempt whose outcome is known but whose audit row is not written yet.
     */
    public FraudAssessment assess(FraudAttempt attempt) {
        FraudAssessment.FraudAssessmentBuilder assessment = FraudAssessment.builder().attempt(attempt);

        if (attempt.getStatus() == VerificationStatus.RATE_LIMITED) {
            assessment.signal(FraudSignal.builder()
                    .type(FraudEventType.INVALID_PIN_ATTEMPTS)
                    .severity(FraudSeverity.HIGH)
                    .description(pinFailureThreshold + " or more failed PIN attempts within "
                            + pinFailureWindowMinutes + " minutes")
                    .metadata("threshold=" + pinFailureThreshold + ";windowMinutes=" + pinFailureWindowMinutes)
                    .build());
        }
        if (attempt.getFailureCode() == ClaimFailureCode.CREDENTIAL_MISMATCH) {
            assessment.signal(FraudSignal.builder()
                    .type(FraudEventType.DUPLICATE_CLAIM_ATTEMPT)
                    .severity(FraudSeverity.HIGH)
                    .description("Signed credential does not describe the stored claim; possible cloned or replayed credential")
                    .metadata("attemptType=" + attempt.getAttemptType())
                    .build());
        }
        if (attempt.getFailureCode() == ClaimFailureCode.INVALID_CREDENTIAL && attempt.getClaimId() != null) {
            assessment.signal(FraudSignal.builder()
                    .type(FraudEventType.SUSPICIOUS_PATTERN)
                    .severity(FraudSeverity.LOW)
                    .description("Forged or corrupted credential presented with the code of an existing claim")
                    .metadata("attemptType=" + attempt.getAttemptType())
                    .build());
        }
        if (attempt.getAttemptType() == AttemptType.REDEEM && attempt.getStatus() == VerificationStatus.EXPIRED) {
            assessment.signal(FraudSignal.builder()
                    .type(FraudEventType.EXPIRED_CLAIM_USE)
                    .severity(FraudSeverity.MEDIUM)
                    .description("Redemption attempted after claim expiry")
                    .build());
        }
        if (isCrossMerchant(attempt)) {
            assessment.signal(FraudSignal.builder()
                    .type(FraudEventType.CROSS_MERCHANT_CLAIM)
                    .severity(FraudSeverity.MEDIUM)
                    .description("Claim presented at a merchant other than the store of purchase")
                    .metadata("originMerchantId=" + attempt.getOriginMerchantId()
                            + ";actingMerchantId=" + attempt.getMerchantId())
                    .build());
        }

        FraudAssessment result = assessment.build();
        if (!result.isEmpty()) {
            log.warn("Fraud signals on attempt: type={} claimId={} merchantId={} signals={}",
                    attempt.getAttemptType(), attempt.getClaimId(), attempt.getMerchantId(),
                    result.getSignals().stream().map(FraudSignal::getType).toList());
        }
        return result;
    }

    /**
     * Persists and publishes one event per signal, referencing the attempt's audit row.
     * INVALID_PIN_ATTEMPTS is raised once per claim per window. A failed event write is logged
     * and does not undo the attempt it describes.
     */
    public List<FraudEvent> record(FraudAssessment assessment, String verificationId) {
        List<FraudEvent> recorded = new ArrayList<>();
        if (assessment == null || assessment.isEmpty()) {
            return recorded;
        }
        FraudAttempt attempt = assessment.getAttempt();
        Instant now = clock.instant();
        for (FraudSignal signal : assessment.getSignals()) {
            boolean oncePerWindow = signal.getType() == FraudEventType.INVALID_PIN_ATTEMPTS && attempt.getClaimId() != null;
            FraudEvent event = FraudEvent.builder()
                    .id(UUID.randomUUID().toString())
                    .claimId(attempt.getClaimId())
                    .purchaseId(attempt.getPurchaseId())
                    .userId(attempt.getUserId())
                    .merchantId(attempt.getMerchantId())
                    .eventType(signal.getType())
                    .severity(signal.getSeverity())
                    .description(signal.getDescription())
                    .metadata(signal.getMetadata())
                    .verificationId(verificationId)
                    .createdAt(now)
                    .build();
            try {
                FraudEvent saved;
                if (oncePerWindow) {
                    Optional<FraudEvent> first = persistenceService.persistOnce(event,
                            now.minus(Duration.ofMinutes(pinFailureWindowMinutes)));
                    if (first.isEmpty()) {
                        log.debug("INVALID_PIN_ATTEMPTS already raised for claimId={} in current window", attempt.getClaimId());
                        continue;
                    }
                    saved = first.get();
                } else {
                    saved = persistenceService.persist(event);
                }
                fraudEventProducer.send(saved);
                recorded.add(saved);
                log.info("Fraud event recorded: id={} type={} severity={} claimId={}",
                        saved.getId(), saved.getEventType(), saved.getSeverity(), saved.getClaimId());
            } catch (Exception e) {
                log.error("Failed to record fraud event type={} claimId={} verificationId={}",
                        signal.getType(), attempt.getClaimId(), verificationId, e);
            }
        }
        return recorded;
    }

    public FraudEvent flagSuspiciousPattern(SuspiciousPatternReport report) {
        if (report.getDescription() == null || report.getDescription().isBlank()) {
            throw new IllegalArgumentException("description is required");
        }
        FraudEvent event = FraudEvent.builder()
                .id(UUID.randomUUID().toString())
                .claimId(report.getClaimId())
                .purchaseId(report.getPurchaseId())
                .userId(report.getUserId())
                .merchantId(report.getMerchantId())
                .eventType(FraudEventType.SUSPICIOUS_PATTERN)
                .severity(report.getSeverity() != null ? report.getSeverity() : FraudSeverity.LOW)
                .description(report.getDescription())
                .metadata(report.getMetadata())
                .createdAt(clock.instant())
                .build();
        FraudEvent saved = persistenceService.persist(event);
        fraudEventProducer.send(saved);
        log.info("Suspicious pattern flagged: id={} claimId={} severity={}", saved.getId(), saved.getClaimId(), saved.getSeverity());
        return saved;
    }

    /**
     * Marks the event resolved. Resolving an already resolved event keeps the first resolution.
     * Never touches claim state.
     *
     * @throws FraudEventNotFoundException for unknown ids
     */
    public FraudEvent resolveFraudEvent(String id, String resolvedBy) {
        if (persistenceService.findById(id).isEmpty()) {
            throw new FraudEventNotFoundException(id);
        }
        boolean changed = persistenceService.resolve(id, resolvedBy, clock.instant());
        if (changed) {
            log.info("Fraud event resolved: id={} resolvedBy={}", id, resolvedBy);
        } else {
            log.debug("Fraud event already resolved: id={}", id);
        }
        return persistenceService.findById(id).orElseThrow(() -> new FraudEventNotFoundException(id));
    }

    public Page<FraudEvent> listFraudEvents(FraudEventFilter filter, Pageable pageable) {
        return persistenceService.search(filter != null ? filter : FraudEventFilter.builder().build(), pageable);
    }

    private static boolean isCrossMerchant(FraudAttempt attempt) {
        return attempt.getAttemptType() != AttemptType.VERIFY
                && attempt.getClaimId() != null
                && attempt.getMerchantId() != null
                && attempt.getOriginMerchantId() != null
                && !attempt.getOriginMerchantId().equals(attempt.getMerchantId());
    }
}
