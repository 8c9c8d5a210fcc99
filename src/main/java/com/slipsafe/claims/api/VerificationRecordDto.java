package com.slipsafe.claims.api;

import com.slipsafe.claims.domain.AttemptType;
import com.slipsafe.claims.domain.ClaimFailureCode;
import com.slipsafe.claims.domain.VerificationResult;
import com.slipsafe.claims.domain.VerificationStatus;
import com.slipsafe.claims.persistence.entity.ClaimVerificationEntity;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Audit row as shown in a merchant's verification history. The attempted PIN is never exposed.
 */
@Value
@Builder
public class VerificationRecordDto {

    String id;
    String claimId;
    String claimCode;
    AttemptType attemptType;
    String merchantUserId;
    VerificationResult result;
    VerificationStatus status;
    ClaimFailureCode failureCode;
    Boolean pinCorrect;
    BigDecimal refundAmount;
    String notes;
    Instant createdAt;

    public static VerificationRecordDto from(ClaimVerificationEntity entity) {
        return VerificationRecordDto.builder()
                .id(entity.getId())
                .claimId(entity.getClaimId())
                .claimCode(entity.getAttemptedClaimCode())
                .attemptType(entity.getAttemptType())
                .merchantUserId(entity.getMerchantUserId())
                .result(entity.getResult())
                .status(entity.getStatus())
                .failureCode(entity.getFailureCode())
                .pinCorrect(entity.getPinCorrect())
                .refundAmount(entity.getRefundAmount())
                .notes(entity.getNotes())
                .createdAt(entity.getCreatedAt())
                .build();
    }
}
