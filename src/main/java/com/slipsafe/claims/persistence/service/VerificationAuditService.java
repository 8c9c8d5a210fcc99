package com.slipsafe.claims.persistence.service;

import com.slipsafe.claims.domain.AttemptType;
import com.slipsafe.claims.domain.ClaimFailureCode;
import com.slipsafe.claims.domain.VerificationResult;
import com.slipsafe.claims.domain.VerificationStatus;
import com.slipsafe.claims.persistence.entity.ClaimVerificationEntity;
import com.slipsafe.claims.persistence.repository.ClaimVerificationRepository;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Writes and reads the verification audit log. Unlike event publishing, a failed audit write
 * propagates: an attempt that cannot be recorded is not answered.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VerificationAuditService {

    private final ClaimVerificationRepository verificationRepository;

    @Transactional
    public ClaimVerificationEntity record(AuditEntry entry) {
        ClaimVerificationEntity entity = ClaimVerificationEntity.builder()
                .id(UUID.randomUUID().toString())
                .claimId(entry.getClaimId())
                .attemptedClaimCode(entry.getAttemptedClaimCode())
                .attemptType(entry.getAttemptType())
                .merchantId(entry.getMerchantId())
                .merchantUserId(entry.getMerchantUserId())
                .result(entry.getResult())
                .status(entry.getStatus())
                .failureCode(entry.getFailureCode())
                .pinAttempted(entry.getPinAttempted())
                .pinCorrect(entry.getPinCorrect())
                .refundAmount(entry.getRefundAmount())
                .notes(entry.getNotes())
                .ipAddress(entry.getIpAddress())
                .userAgent(entry.getUserAgent())
                .createdAt(entry.getCreatedAt())
                .build();
        ClaimVerificationEntity saved = verificationRepository.save(entity);
        log.debug("Persisted verification: id={}, claimId={}, type={}, status={}, result={}",
                saved.getId(), saved.getClaimId(), saved.getAttemptType(), saved.getStatus(), saved.getResult());
        return saved;
    }

    @Transactional(readOnly = true)
    public long countFailedPinAttemptsSince(String claimId, Instant since) {
        return verificationRepository.countFailedPinAttemptsSince(claimId, since);
    }

    @Transactional(readOnly = true)
    public Page<ClaimVerificationEntity> findByMerchant(String merchantId, Pageable pageable) {
        return verificationRepository.findByMerchantIdOrderByCreatedAtDesc(merchantId, pageable);
    }

    /**
     * Everything recorded about a single attempt.
     */
    @Value
    @Builder
    public static class AuditEntry {
        String claimId;
        String attemptedClaimCode;
        AttemptType attemptType;
        String merchantId;
        String merchantUserId;
        VerificationResult result;
        VerificationStatus status;
        ClaimFailureCode failureCode;
        String pinAttempted;
        Boolean pinCorrect;
        BigDecimal refundAmount;
        String notes;
        String ipAddress;
        String userAgent;
        Instant createdAt;
    }
}
