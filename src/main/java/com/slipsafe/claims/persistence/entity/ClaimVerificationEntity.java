package com.slipsafe.claims.persistence.entity;

import com.slipsafe.claims.domain.AttemptType;
import com.slipsafe.claims.domain.ClaimFailureCode;
import com.slipsafe.claims.domain.VerificationResult;
import com.slipsafe.claims.domain.VerificationStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One row per verification, hold or redemption attempt. Append-only.
 */
@Entity
@Immutable
@Table(name = "claim_verifications", indexes = {
    @Index(name = "idx_verification_claim_created", columnList = "claim_id, created_at"),
    @Index(name = "idx_verification_merchant", columnList = "merchant_id"),
    @Index(name = "idx_verification_created_at", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClaimVerificationEntity {

    @Id
    @Column(name = "id", nullable = false, length = 36)
    private String id;

    /** Null when the attempted code matched no claim. */
    @Column(name = "claim_id", length = 36)
    private String claimId;

    @Column(name = "attempted_claim_code", length = 64)
    private String attemptedClaimCode;

    @Enumerated(EnumType.STRING)
    @Column(name = "attempt_type", nullable = false, length = 16)
    private AttemptType attemptType;

    @Column(name = "merchant_id")
    private String merchantId;

    @Column(name = "merchant_user_id")
    private String merchantUserId;

    @Enumerated(EnumType.STRING)
    @Column(name = "result", nullable = false, length = 24)
    private VerificationResult result;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 24)
    private VerificationStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_code", length = 32)
    private ClaimFailureCode failureCode;

    @Column(name = "pin_attempted", length = 16)
    private String pinAttempted;

    /** Null when the PIN was never compared (unknown code, rate limited, invalid credential). */
    @Column(name = "pin_correct")
    private Boolean pinCorrect;

    @Column(name = "refund_amount", precision = 19, scale = 2)
    private BigDecimal refundAmount;

    @Column(name = "notes", length = 1000)
    private String notes;

    @Column(name = "ip_address", length = 64)
    private String ipAddress;

    @Column(name = "user_agent", length = 512)
    private String userAgent;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
