package com.slipsafe.claims.core;

import com.slipsafe.claims.api.InvalidAmountException;
import com.slipsafe.claims.api.MerchantAccessDeniedException;
import com.slipsafe.claims.compliance.ClaimAuditLogger;
import com.slipsafe.claims.compliance.SecretMasker;
import com.slipsafe.claims.domain.AttemptType;
import com.slipsafe.claims.domain.ClaimFailureCode;
import com.slipsafe.claims.domain.ClaimState;
import com.slipsafe.claims.domain.ClaimSummary;
import com.slipsafe.claims.domain.RedemptionOutcome;
import com.slipsafe.claims.domain.RedemptionRequest;
import com.slipsafe.claims.domain.VerificationRequest;
import com.slipsafe.claims.domain.VerificationResult;
import com.slipsafe.claims.domain.VerificationStatus;
import com.slipsafe.claims.ledger.MerchantDirectory;
import com.slipsafe.claims.ledger.MerchantStaff;
import com.slipsafe.claims.messaging.ClaimEventProducer;
import com.slipsafe.claims.persistence.entity.ClaimEntity;
import com.slipsafe.claims.persistence.repository.ClaimRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;

/**
 * Performs claim state transitions on behalf of authenticated merchant staff. Each transition is a
 * single conditional update that only succeeds while the claim is open, so a claim reaches a terminal
 * state exactly once no matter how many callers race.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClaimRedeemer {

    private final ClaimVerifier verifier;
    private final ClaimRepository claimRepository;
    private final MerchantDirectory merchantDirectory;
    private final ClaimEventProducer eventProducer;
    private final ClaimAuditLogger auditLogger;
    private final Clock clock;

    /**
     * Redeems (fully or partially) or refuses a claim.
     *
     * @throws MerchantAccessDeniedException caller is not active staff of an active merchant
     * @throws InvalidAmountException        refund amount missing, non-positive, or inconsistent with the claim
     */
    public RedemptionOutcome redeem(RedemptionRequest request) {
        MerchantStaff staff = requireStaff(request.getMerchantId(), request.getMerchantUserId());
        validateInput(request);

        VerificationRequest verification = request.toVerificationRequest();
        Evaluation evaluation = verifier.evaluate(verification);
        if (!evaluation.isMatch()) {
            return rejected(AttemptType.REDEEM, verification, evaluation, request.getRefundAmount());
        }

        ClaimEntity claim = evaluation.getClaim();
        ClaimState target;
        BigDecimal amount;
        if (request.isRefuse()) {
            target = ClaimState.REFUSED;
            amount = null;
        } else if (request.isPartial()) {
            BigDecimal refund = request.getRefundAmount();
            if (refund.compareTo(claim.getOriginalAmount()) >= 0) {
                throw amountRejected(verification, evaluation, refund,
                        "Partial refund " + refund + " must be less than the original amount " + claim.getOriginalAmount());
            }
            target = ClaimState.PARTIAL;
            amount = refund;
        } else {
            BigDecimal refund = request.getRefundAmount();
            if (refund != null && refund.compareTo(claim.getOriginalAmount()) != 0) {
                throw amountRejected(verification, evaluation, refund,
                        "Full redemption must refund the original amount " + claim.getOriginalAmount());
            }
            target = ClaimState.REDEEMED;
            amount = claim.getOriginalAmount();
        }

        Instant now = clock.instant();
        int updated = claimRepository.settle(claim.getId(), target, amount, staff.getMerchantId(), staff.getMerchantUserId(), now);
        if (updated == 0) {
            return lostRace(AttemptType.REDEEM, verification, evaluation, request.getRefundAmount());
        }

        auditLogger.logTransition(claim, claim.getState(), target, staff.getMerchantId(), staff.getMerchantUserId());
        eventProducer.publishTransition(claim, target, amount, staff.getMerchantId(), staff.getMerchantUserId());
        VerificationResult result = target == ClaimState.REDEEMED ? VerificationResult.APPROVED
                : target == ClaimState.PARTIAL ? VerificationResult.PARTIAL_APPROVED
                : VerificationResult.REJECTED;
        String verificationId = verifier.recordAttempt(AttemptType.REDEEM, verification, evaluation,
                VerificationStatus.MATCH, null, result, amount != null ? amount : request.getRefundAmount());
        log.info("Claim {}: claimId={} amount={} merchantId={}", target, claim.getId(), amount, staff.getMerchantId());
        return RedemptionOutcome.builder()
                .verificationId(verificationId)
                .status(VerificationStatus.MATCH)
                .newState(target)
                .redeemedAmount(amount)
                .claim(reload(claim))
                .message("Claim " + target.name().toLowerCase(Locale.ROOT))
                .build();
    }

    /**
     * Moves an issued claim to PENDING while staff inspect the item. Holding a claim that is already
     * pending is a successful no-op.
     *
     * @throws MerchantAccessDeniedException caller is not active staff of an active merchant
     */
    public RedemptionOutcome hold(VerificationRequest request) {
        MerchantStaff staff = requireStaff(request.getMerchantId(), request.getMerchantUserId());
        Evaluation evaluation = verifier.evaluate(request);
        if (!evaluation.isMatch()) {
            return rejected(AttemptType.HOLD, request, evaluation, null);
        }
        ClaimEntity claim = evaluation.getClaim();
        if (claim.getState() == ClaimState.ISSUED) {
            int updated = claimRepository.hold(claim.getId(), clock.instant());
            if (updated == 1) {
                auditLogger.logTransition(claim, ClaimState.ISSUED, ClaimState.PENDING, staff.getMerchantId(), staff.getMerchantUserId());
                eventProducer.publishTransition(claim, ClaimState.PENDING, null, staff.getMerchantId(), staff.getMerchantUserId());
            } else {
                ClaimEntity current = claimRepository.findById(claim.getId()).orElse(claim);
                if (current.getState() != ClaimState.PENDING) {
                    return lostRace(AttemptType.HOLD, request, evaluation, null);
                }
            }
        }
        String verificationId = verifier.recordAttempt(AttemptType.HOLD, request, evaluation,
                VerificationStatus.MATCH, null, VerificationResult.APPROVED, null);
        return RedemptionOutcome.builder()
                .verificationId(verificationId)
                .status(VerificationStatus.MATCH)
                .newState(ClaimState.PENDING)
                .claim(reload(claim))
                .message("Claim on hold")
                .build();
    }

    private RedemptionOutcome rejected(AttemptType attemptType, VerificationRequest request, Evaluation evaluation,
                                       BigDecimal refundAmount) {
        ClaimEntity claim = evaluation.getClaim();
        ClaimState newState = null;
        if (claim != null) {
            Instant now = clock.instant();
            newState = claim.effectiveState(now);
            if (attemptType == AttemptType.REDEEM && evaluation.getStatus() == VerificationStatus.EXPIRED
                    && claim.isLapsed(now) && claimRepository.expire(claim.getId(), now) == 1) {
                auditLogger.logTransition(claim, claim.getState(), ClaimState.EXPIRED, request.getMerchantId(), request.getMerchantUserId());
                eventProducer.publishTransition(claim, ClaimState.EXPIRED, null, request.getMerchantId(), request.getMerchantUserId());
            }
        }
        String verificationId = verifier.recordAttempt(attemptType, request, evaluation,
                evaluation.getStatus(), evaluation.getFailureCode(), VerificationResult.REJECTED, refundAmount);
        log.warn("Claim {} rejected: claimCode={} status={} failureCode={}", attemptType,
                SecretMasker.maskClaimCode(evaluation.getAttemptedClaimCode()),
                evaluation.getStatus(), evaluation.getFailureCode());
        return RedemptionOutcome.builder()
                .verificationId(verificationId)
                .status(evaluation.getStatus())
                .failureCode(evaluation.getFailureCode())
                .newState(newState)
                .claim(claim != null ? reload(claim) : null)
                .message(evaluation.getMessage())
                .build();
    }

    /** The conditional update matched no row: another caller settled the claim first. */
    private RedemptionOutcome lostRace(AttemptType attemptType, VerificationRequest request, Evaluation evaluation,
                                       BigDecimal refundAmount) {
        ClaimEntity current = claimRepository.findById(evaluation.getClaim().getId()).orElse(evaluation.getClaim());
        ClaimState state = current.effectiveState(clock.instant());
        VerificationStatus status = state == ClaimState.EXPIRED ? VerificationStatus.EXPIRED : VerificationStatus.ALREADY_REDEEMED;
        String verificationId = verifier.recordAttempt(attemptType, request, evaluation,
                status, ClaimFailureCode.ALREADY_TERMINAL, VerificationResult.REJECTED, refundAmount);
        log.info("Claim {} lost race: claimId={} currentState={}", attemptType, current.getId(), state);
        return RedemptionOutcome.builder()
                .verificationId(verificationId)
                .status(status)
                .failureCode(ClaimFailureCode.ALREADY_TERMINAL)
                .newState(state)
                .claim(current.toSummary(clock.instant()))
                .message("Claim already " + state)
                .build();
    }

    private InvalidAmountException amountRejected(VerificationRequest request, Evaluation evaluation,
                                                  BigDecimal refund, String message) {
        String verificationId = verifier.recordAttempt(AttemptType.REDEEM, request, evaluation,
                VerificationStatus.MATCH, ClaimFailureCode.INVALID_AMOUNT, VerificationResult.REJECTED, refund);
        log.warn("Redemption amount rejected: claimId={} refund={} reason={}", evaluation.getClaim().getId(), refund, message);
        return new InvalidAmountException(message, verificationId);
    }

    private MerchantStaff requireStaff(String merchantId, String merchantUserId) {
        return merchantDirectory.findActiveStaff(merchantId, merchantUserId)
                .orElseThrow(() -> {
                    log.warn("Merchant access denied: merchantId={} merchantUserId={}", merchantId, merchantUserId);
                    return new MerchantAccessDeniedException("Merchant " + merchantId + " / user " + merchantUserId
                            + " is not an active merchant staff account");
                });
    }

    private static void validateInput(RedemptionRequest request) {
        if (request.isRefuse() && request.isPartial()) {
            throw new IllegalArgumentException("A claim cannot be refused and partially redeemed at once");
        }
        BigDecimal refund = request.getRefundAmount();
        if (refund != null && refund.signum() <= 0) {
            throw new InvalidAmountException("refundAmount must be greater than zero");
        }
        if (refund != null && refund.stripTrailingZeros().scale() > 2) {
            throw new InvalidAmountException("refundAmount must not have more than two decimal places");
        }
        if (request.isPartial() && refund == null) {
            throw new InvalidAmountException("refundAmount is required for a partial redemption");
        }
    }

    private ClaimSummary reload(ClaimEntity claim) {
        ClaimEntity current = claimRepository.findById(claim.getId()).orElse(claim);
        return current.toSummary(clock.instant());
    }
}
