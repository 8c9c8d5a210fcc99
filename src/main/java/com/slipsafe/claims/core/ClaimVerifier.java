package com.slipsafe.claims.core;

import com.slipsafe.claims.compliance.ClaimAuditLogger;
import com.slipsafe.claims.compliance.SecretMasker;
import com.slipsafe.claims.core.credential.ClaimCredential;
import com.slipsafe.claims.core.credential.ClaimCredentialSigner;
import com.slipsafe.claims.core.credential.InvalidCredentialException;
import com.slipsafe.claims.domain.AttemptType;
import com.slipsafe.claims.domain.ClaimComparison;
import com.slipsafe.claims.domain.ClaimFailureCode;
import com.slipsafe.claims.domain.ClaimState;
import com.slipsafe.claims.domain.ClaimSummary;
import com.slipsafe.claims.domain.ClaimType;
import com.slipsafe.claims.domain.Purchase;
import com.slipsafe.claims.domain.VerificationOutcome;
import com.slipsafe.claims.domain.VerificationRequest;
import com.slipsafe.claims.domain.VerificationResult;
import com.slipsafe.claims.domain.VerificationStatus;
import com.slipsafe.claims.fraud.domain.FraudAssessment;
import com.slipsafe.claims.fraud.domain.FraudAttempt;
import com.slipsafe.claims.fraud.engine.FraudDetector;
import com.slipsafe.claims.ledger.PurchaseLedger;
import com.slipsafe.claims.persistence.entity.ClaimEntity;
import com.slipsafe.claims.persistence.entity.ClaimVerificationEntity;
import com.slipsafe.claims.persistence.repository.ClaimRepository;
import com.slipsafe.claims.persistence.service.VerificationAuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Merchant-side verification of a presented claim. Read-only with respect to claim state; every
 * call writes exactly one audit row before returning.
 *
 * <p>Checks run in a fixed order: credential signature, claim lookup, expiry, PIN throttling,
 * PIN, credential consistency, terminal state. The first failing check decides the status.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClaimVerifier {

    private final ClaimRepository claimRepository;
    private final PurchaseLedger purchaseLedger;
    private final ClaimCredentialSigner credentialSigner;
    private final FraudDetector fraudDetector;
    private final VerificationAuditService auditService;
    private final ClaimAuditLogger auditLogger;
    private final Clock clock;

    public VerificationOutcome verify(VerificationRequest request) {
        Evaluation evaluation = evaluate(request);
        VerificationResult base = evaluation.isMatch() ? VerificationResult.APPROVED : VerificationResult.REJECTED;
        String verificationId = recordAttempt(AttemptType.VERIFY, request, evaluation,
                evaluation.getStatus(), evaluation.getFailureCode(), base, null);
        return VerificationOutcome.builder()
                .verificationId(verificationId)
                .status(evaluation.getStatus())
                .failureCode(evaluation.getFailureCode())
                .claim(evaluation.getClaim() != null ? evaluation.getClaim().toSummary(clock.instant()) : null)
                .purchase(evaluation.getPurchase())
                .comparison(evaluation.getComparison())
                .message(evaluation.getMessage())
                .build();
    }

    /** Public claim lookup by code, as used by merchant portals before the PIN is entered. Never exposes the PIN. */
    public Optional<ClaimSummary> lookup(String claimCode) {
        if (claimCode == null || claimCode.isBlank()) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        return claimRepository.findByClaimCode(normalizeCode(claimCode)).map(c -> c.toSummary(now));
    }

    public List<ClaimSummary> claimsForUser(String userId) {
        Instant now = clock.instant();
        return claimRepository.findByUserIdOrderByCreatedAtDesc(userId).stream()
                .map(c -> c.toSummary(now))
                .collect(Collectors.toList());
    }

    Evaluation evaluate(VerificationRequest request) {
        String typedCode = normalizeCode(request.getClaimCode());
        Evaluation.EvaluationBuilder result = Evaluation.builder().attemptedClaimCode(typedCode);

        ClaimCredential credential = null;
        if (request.getCredential() != null && !request.getCredential().isBlank()) {
            try {
                credential = credentialSigner.parse(stripVerifierUrl(request.getCredential()));
                result.credential(credential);
            } catch (InvalidCredentialException e) {
                log.warn("Invalid credential presented: claimCode={} credential={} merchantId={} reason={}",
                        SecretMasker.maskClaimCode(typedCode), SecretMasker.maskCredential(request.getCredential()),
                        request.getMerchantId(), e.getMessage());
                ClaimEntity typedClaim = typedCode != null ? claimRepository.findByClaimCode(typedCode).orElse(null) : null;
                return result.claim(typedClaim)
                        .status(VerificationStatus.INVALID)
                        .failureCode(ClaimFailureCode.INVALID_CREDENTIAL)
                        .message("Credential could not be verified")
                        .build();
            }
        }

        String code = typedCode != null ? typedCode : (credential != null ? credential.getClaimCode() : null);
        result.attemptedClaimCode(code);
        Optional<ClaimEntity> found = code != null ? claimRepository.findByClaimCode(code) : Optional.empty();
        if (found.isEmpty()) {
            log.warn("Verification for unknown claim code={} merchantId={}",
                    SecretMasker.maskClaimCode(code), request.getMerchantId());
            return result.status(VerificationStatus.INVALID)
                    .failureCode(ClaimFailureCode.NOT_FOUND)
                    .message("Claim not found")
                    .build();
        }
        ClaimEntity claim = found.get();
        result.claim(claim);
        Instant now = clock.instant();
        Purchase purchase = purchaseLedger.findPurchase(claim.getPurchaseId()).orElse(null);
        ClaimComparison comparison = compare(claim, credential, purchase, LocalDate.ofInstant(now, ZoneOffset.UTC));
        result.comparison(comparison);

        if (claim.getState() == ClaimState.EXPIRED || claim.isLapsed(now)) {
            boolean pinCorrect = pinMatches(claim.getPin(), request.getPin());
            return result.status(VerificationStatus.EXPIRED)
                    .failureCode(ClaimFailureCode.EXPIRED)
                    .pinCorrect(pinCorrect)
                    .message("Claim expired at " + claim.getExpiresAt())
                    .build();
        }

        if (fraudDetector.isPinThrottled(claim.getId())) {
            return result.status(VerificationStatus.RATE_LIMITED)
                    .failureCode(ClaimFailureCode.RATE_LIMITED)
                    .message("Too many failed PIN attempts; try again later")
                    .build();
        }

        if (!pinMatches(claim.getPin(), request.getPin())) {
            return result.status(VerificationStatus.NO_MATCH)
                    .failureCode(ClaimFailureCode.PIN_MISMATCH)
                    .pinCorrect(false)
                    .message("PIN does not match")
                    .build();
        }
        result.pinCorrect(true).purchase(purchase);

        if (!comparison.credentialMatches()) {
            return result.status(VerificationStatus.NO_MATCH)
                    .failureCode(ClaimFailureCode.CREDENTIAL_MISMATCH)
                    .message("Credential does not match the stored claim")
                    .build();
        }

        if (claim.getState().isTerminal()) {
            return result.status(VerificationStatus.ALREADY_REDEEMED)
                    .failureCode(ClaimFailureCode.ALREADY_TERMINAL)
                    .message("Claim already " + claim.getState())
                    .build();
        }

        return result.status(VerificationStatus.MATCH)
                .message(comparison.isEligible() ? "Claim verified" : "Claim verified; outside the purchase policy window")
                .build();
    }

    /**
     * Runs fraud assessment, writes the audit row, then records fraud events against it.
     *
     * @return id of the audit row
     */
    String recordAttempt(AttemptType attemptType, VerificationRequest request, Evaluation evaluation,
                         VerificationStatus status, ClaimFailureCode failureCode, VerificationResult baseResult,
                         BigDecimal refundAmount) {
        ClaimEntity claim = evaluation.getClaim();
        FraudAttempt attempt = FraudAttempt.builder()
                .attemptType(attemptType)
                .attemptedClaimCode(evaluation.getAttemptedClaimCode())
                .claimId(claim != null ? claim.getId() : null)
                .purchaseId(claim != null ? claim.getPurchaseId() : null)
                .userId(claim != null ? claim.getUserId() : null)
                .originMerchantId(claim != null ? claim.getOriginMerchantId() : null)
                .merchantId(request.getMerchantId())
                .status(status)
                .failureCode(failureCode)
                .build();
        FraudAssessment assessment = fraudDetector.assess(attempt);
        VerificationResult result = assessment.isSuspected() ? VerificationResult.FRAUD_SUSPECTED : baseResult;

        ClaimVerificationEntity row = auditService.record(VerificationAuditService.AuditEntry.builder()
                .claimId(attempt.getClaimId())
                .attemptedClaimCode(evaluation.getAttemptedClaimCode())
                .attemptType(attemptType)
                .merchantId(request.getMerchantId())
                .merchantUserId(request.getMerchantUserId())
                .result(result)
                .status(status)
                .failureCode(failureCode)
                .pinAttempted(request.getPin())
                .pinCorrect(evaluation.getPinCorrect())
                .refundAmount(refundAmount)
                .notes(request.getNotes())
                .ipAddress(request.getClientIp())
                .userAgent(request.getUserAgent())
                .createdAt(clock.instant())
                .build());

        fraudDetector.record(assessment, row.getId());
        auditLogger.logAttempt(attemptType, evaluation.getAttemptedClaimCode(), attempt.getClaimId(),
                request.getMerchantId(), status, failureCode, result, row.getId());
        return row.getId();
    }

    static ClaimComparison compare(ClaimEntity claim, ClaimCredential credential, Purchase purchase, LocalDate today) {
        ClaimComparison.ClaimComparisonBuilder comparison = ClaimComparison.builder()
                .credentialPresented(credential != null);
        if (credential != null) {
            comparison.claimCodeMatch(claim.getClaimCode().equals(credential.getClaimCode()))
                    .merchantMatch(claim.getMerchantName().equals(credential.getMerchantName()))
                    .dateMatch(claim.getPurchaseDate().equals(credential.getPurchaseDate()))
                    .amountMatch(toCents(claim.getOriginalAmount()).compareTo(toCents(credential.getAmount())) == 0)
                    .fingerprintMatch(claim.getPurchaseFingerprint().equals(credential.getFingerprint()));
        }
        Boolean withinReturn = null;
        Boolean withinWarranty = null;
        if (purchase != null) {
            withinReturn = purchase.getReturnBy() != null ? !today.isAfter(purchase.getReturnBy()) : null;
            withinWarranty = purchase.getWarrantyEnds() != null ? !today.isAfter(purchase.getWarrantyEnds()) : null;
        }
        boolean eligible = claim.getClaimType() == ClaimType.WARRANTY
                ? Boolean.TRUE.equals(withinWarranty)
                : Boolean.TRUE.equals(withinReturn);
        return comparison.withinReturnWindow(withinReturn)
                .withinWarranty(withinWarranty)
                .eligible(eligible)
                .build();
    }

    static boolean pinMatches(String expected, String attempted) {
        if (expected == null || attempted == null) {
            return false;
        }
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
                attempted.trim().getBytes(StandardCharsets.UTF_8));
    }

    static String normalizeCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.replace("-", "").replace(" ", "").trim().toUpperCase(Locale.ROOT);
        return normalized.isEmpty() ? null : normalized;
    }

    /** Accepts either the bare token or the full QR payload ({@code .../claim/<token>}). */
    static String stripVerifierUrl(String credential) {
        String trimmed = credential.trim();
        int idx = trimmed.lastIndexOf("/claim/");
        return idx >= 0 ? trimmed.substring(idx + "/claim/".length()) : trimmed;
    }

    private static BigDecimal toCents(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP);
    }
}
