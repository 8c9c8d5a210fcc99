package com.slipsafe.claims.fraud.engine;

import com.slipsafe.claims.api.FraudEventNotFoundException;
import com.slipsafe.claims.domain.AttemptType;
import com.slipsafe.claims.domain.ClaimFailureCode;
import com.slipsafe.claims.domain.VerificationStatus;
import com.slipsafe.claims.fraud.domain.FraudAssessment;
import com.slipsafe.claims.fraud.domain.FraudAttempt;
import com.slipsafe.claims.fraud.domain.FraudEvent;
import com.slipsafe.claims.fraud.domain.FraudEventType;
import com.slipsafe.claims.fraud.domain.FraudSeverity;
import com.slipsafe.claims.fraud.domain.FraudSignal;
import com.slipsafe.claims.fraud.domain.SuspiciousPatternReport;
import com.slipsafe.claims.fraud.messaging.FraudEventProducer;
import com.slipsafe.claims.persistence.service.FraudEventPersistenceService;
import com.slipsafe.claims.persistence.service.VerificationAuditService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FraudDetectorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock private VerificationAuditService auditService;
    @Mock private FraudEventPersistenceService persistenceService;
    @Mock private FraudEventProducer fraudEventProducer;

    private FraudDetector detector;

    @BeforeEach
    void setUp() {
        detector = new FraudDetector(auditService, persistenceService, fraudEventProducer, Clock.fixed(NOW, ZoneOffset.UTC));
        ReflectionTestUtils.setField(detector, "pinFailureThreshold", 5);
        ReflectionTestUtils.setField(detector, "pinFailureWindowMinutes", 15);
    }

    private static FraudAttempt.FraudAttemptBuilder attempt() {
        return FraudAttempt.builder()
                .attemptType(AttemptType.VERIFY)
                .attemptedClaimCode("ABCDEFGHJKLMNPQR")
                .claimId("c1")
                .purchaseId("p1")
                .userId("u1")
                .originMerchantId("m-acme")
                .merchantId("m-acme");
    }

    private static List<FraudEventType> types(FraudAssessment assessment) {
        return assessment.getSignals().stream().map(FraudSignal::getType).toList();
    }

    @Test
    void isPinThrottled_atThreshold_isTrue() {
        when(auditService.countFailedPinAttemptsSince("c1", NOW.minus(Duration.ofMinutes(15)))).thenReturn(5L);

        assertThat(detector.isPinThrottled("c1")).isTrue();
    }

    @Test
    void isPinThrottled_belowThreshold_isFalse() {
        when(auditService.countFailedPinAttemptsSince("c1", NOW.minus(Duration.ofMinutes(15)))).thenReturn(4L);

        assertThat(detector.isPinThrottled("c1")).isFalse();
    }

    @Test
    void assess_cleanMatch_raisesNothing() {
        FraudAssessment assessment = detector.assess(attempt().status(VerificationStatus.MATCH).build());

        assertThat(assessment.isEmpty()).isTrue();
        assertThat(assessment.isSuspected()).isFalse();
    }

    @Test
    void assess_rateLimited_raisesInvalidPinAttempts() {
        FraudAssessment assessment = detector.assess(attempt()
                .status(VerificationStatus.RATE_LIMITED)
                .failureCode(ClaimFailureCode.RATE_LIMITED)
                .build());

        assertThat(types(assessment)).containsExactly(FraudEventType.INVALID_PIN_ATTEMPTS);
        assertThat(assessment.getSignals().get(0).getSeverity()).isEqualTo(FraudSeverity.HIGH);
        assertThat(assessment.isSuspected()).isTrue();
    }

    @Test
    void assess_credentialMismatch_raisesDuplicateClaimAttempt() {
        FraudAssessment assessment = detector.assess(attempt()
                .status(VerificationStatus.NO_MATCH)
                .failureCode(ClaimFailureCode.CREDENTIAL_MISMATCH)
                .build());

        assertThat(types(assessment)).containsExactly(FraudEventType.DUPLICATE_CLAIM_ATTEMPT);
        assertThat(assessment.isSuspected()).isTrue();
    }

    @Test
    void assess_forgedCredentialForUnknownCode_raisesNothing() {
        FraudAssessment assessment = detector.assess(attempt()
                .claimId(null)
                .originMerchantId(null)
                .status(VerificationStatus.INVALID)
                .failureCode(ClaimFailureCode.INVALID_CREDENTIAL)
                .build());

        assertThat(assessment.isEmpty()).isTrue();
    }

    @Test
    void assess_expiredRedeemAtOtherMerchant_raisesBothSignals() {
        FraudAssessment assessment = detector.assess(attempt()
                .attemptType(AttemptType.REDEEM)
                .merchantId("m-other")
                .status(VerificationStatus.EXPIRED)
                .failureCode(ClaimFailureCode.EXPIRED)
                .build());

        assertThat(types(assessment)).containsExactlyInAnyOrder(
                FraudEventType.EXPIRED_CLAIM_USE, FraudEventType.CROSS_MERCHANT_CLAIM);
        assertThat(assessment.isSuspected()).isFalse();
    }

    @Test
    void assess_verifyAtOtherMerchant_isNotCrossMerchant() {
        FraudAssessment assessment = detector.assess(attempt()
                .merchantId("m-other")
                .status(VerificationStatus.MATCH)
                .build());

        assertThat(assessment.isEmpty()).isTrue();
    }

    @Test
    void record_persistsAndPublishesEachSignal() {
        FraudAssessment assessment = detector.assess(attempt()
                .status(VerificationStatus.NO_MATCH)
                .failureCode(ClaimFailureCode.CREDENTIAL_MISMATCH)
                .build());
        when(persistenceService.persist(any(FraudEvent.class))).thenAnswer(inv -> inv.getArgument(0));

        List<FraudEvent> recorded = detector.record(assessment, "v1");

        assertThat(recorded).hasSize(1);
        assertThat(recorded.get(0).getVerificationId()).isEqualTo("v1");
        assertThat(recorded.get(0).getClaimId()).isEqualTo("c1");
        assertThat(recorded.get(0).getCreatedAt()).isEqualTo(NOW);
        verify(fraudEventProducer).send(recorded.get(0));
    }

    @Test
    void record_invalidPinAttemptsAlreadyRaisedInWindow_isSkipped() {
        FraudAssessment assessment = detector.assess(attempt()
                .status(VerificationStatus.RATE_LIMITED)
                .failureCode(ClaimFailureCode.RATE_LIMITED)
                .build());
        when(persistenceService.persistOnce(any(FraudEvent.class), eq(NOW.minus(Duration.ofMinutes(15)))))
                .thenReturn(Optional.empty());

        List<FraudEvent> recorded = detector.record(assessment, "v7");

        assertThat(recorded).isEmpty();
        verify(persistenceService, never()).persist(any());
        verify(fraudEventProducer, never()).send(any());
    }

    @Test
    void record_firstInvalidPinAttemptsInWindow_isPersistedOnceAndPublished() {
        FraudAssessment assessment = detector.assess(attempt()
                .status(VerificationStatus.RATE_LIMITED)
                .failureCode(ClaimFailureCode.RATE_LIMITED)
                .build());
        when(persistenceService.persistOnce(any(FraudEvent.class), eq(NOW.minus(Duration.ofMinutes(15)))))
                .thenAnswer(inv -> Optional.of(inv.getArgument(0)));

        List<FraudEvent> recorded = detector.record(assessment, "v6");

        assertThat(recorded).extracting(FraudEvent::getEventType).containsExactly(FraudEventType.INVALID_PIN_ATTEMPTS);
        verify(persistenceService, never()).persist(any());
        verify(fraudEventProducer).send(recorded.get(0));
    }

    @Test
    void record_persistenceFailure_isLoggedNotThrown() {
        FraudAssessment assessment = detector.assess(attempt()
                .status(VerificationStatus.NO_MATCH)
                .failureCode(ClaimFailureCode.CREDENTIAL_MISMATCH)
                .build());
        when(persistenceService.persist(any(FraudEvent.class))).thenThrow(new IllegalStateException("db down"));

        assertThat(detector.record(assessment, "v1")).isEmpty();
        verify(fraudEventProducer, never()).send(any());
    }

    @Test
    void flagSuspiciousPattern_defaultsSeverityToLow() {
        when(persistenceService.persist(any(FraudEvent.class))).thenAnswer(inv -> inv.getArgument(0));

        FraudEvent event = detector.flagSuspiciousPattern(SuspiciousPatternReport.builder()
                .claimId("c1")
                .description("Same receipt photographed at three stores")
                .build());

        assertThat(event.getEventType()).isEqualTo(FraudEventType.SUSPICIOUS_PATTERN);
        assertThat(event.getSeverity()).isEqualTo(FraudSeverity.LOW);
        assertThat(event.isResolved()).isFalse();
    }

    @Test
    void flagSuspiciousPattern_blankDescription_isRejected() {
        assertThatThrownBy(() -> detector.flagSuspiciousPattern(SuspiciousPatternReport.builder().description(" ").build()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void resolveFraudEvent_secondResolveKeepsFirstResolution() {
        FraudEvent resolved = FraudEvent.builder()
                .id("f1")
                .eventType(FraudEventType.SUSPICIOUS_PATTERN)
                .severity(FraudSeverity.LOW)
                .resolved(true)
                .resolvedBy("analyst-a")
                .resolvedAt(NOW.minus(Duration.ofHours(1)))
                .build();
        when(persistenceService.findById("f1")).thenReturn(Optional.of(resolved));
        when(persistenceService.resolve("f1", "analyst-b", NOW)).thenReturn(false);

        FraudEvent event = detector.resolveFraudEvent("f1", "analyst-b");

        assertThat(event.getResolvedBy()).isEqualTo("analyst-a");
    }

    @Test
    void resolveFraudEvent_unknownId_throwsNotFound() {
        when(persistenceService.findById("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> detector.resolveFraudEvent("missing", "analyst"))
                .isInstanceOf(FraudEventNotFoundException.class);
        verify(persistenceService, never()).resolve(eq("missing"), any(), any());
    }
}
