package com.slipsafe.claims.compliance;

import com.slipsafe.claims.domain.AttemptType;
import com.slipsafe.claims.domain.ClaimFailureCode;
import com.slipsafe.claims.domain.ClaimState;
import com.slipsafe.claims.domain.VerificationResult;
import com.slipsafe.claims.domain.VerificationStatus;
import com.slipsafe.claims.persistence.entity.ClaimEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes [AUDIT] log lines for claim issuance, verification attempts and state transitions.
 * Complements the verification table with an operational trail that log pipelines can retain.
 */
@Slf4j
@Component
public class ClaimAuditLogger {

    public void logIssued(ClaimEntity claim, boolean reused) {
        log.info("[AUDIT] CLAIM_ISSUED claimId={} claimCode={} pin={} purchaseId={} userId={} type={} expiresAt={} reused={}",
                claim.getId(),
                SecretMasker.maskClaimCode(claim.getClaimCode()),
                SecretMasker.maskPin(claim.getPin()),
                claim.getPurchaseId(),
                claim.getUserId(),
                claim.getClaimType(),
                claim.getExpiresAt(),
                reused);
    }

    public void logAttempt(AttemptType attemptType, String claimCode, String claimId, String merchantId,
                           VerificationStatus status, ClaimFailureCode failureCode, VerificationResult result,
                           String verificationId) {
        log.info("[AUDIT] CLAIM_{} claimCode={} claimId={} merchantId={} status={} failureCode={} result={} verificationId={}",
                attemptType,
                SecretMasker.maskClaimCode(claimCode),
                claimId,
                merchantId,
                status,
                failureCode,
                result,
                verificationId);
    }

    public void logTransition(ClaimEntity claim, ClaimState from, ClaimState to, String merchantId, String merchantUserId) {
        log.info("[AUDIT] CLAIM_TRANSITION claimId={} from={} to={} merchantId={} merchantUserId={}",
                claim.getId(), from, to, merchantId, merchantUserId);
    }
}
