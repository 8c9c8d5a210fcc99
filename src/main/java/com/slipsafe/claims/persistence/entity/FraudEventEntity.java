package com.slipsafe.claims.persistence.entity;

import com.slipsafe.claims.fraud.domain.FraudEventType;
import com.slipsafe.claims.fraud.domain.FraudSeverity;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Persistent entity for fraud events. The only mutation after insert is resolution.
 */
@Entity
@Table(name = "fraud_events", indexes = {
    @Index(name = "idx_fraud_claim", columnList = "claim_id"),
    @Index(name = "idx_fraud_type", columnList = "event_type"),
    @Index(name = "idx_fraud_resolved", columnList = "resolved"),
    @Index(name = "idx_fraud_created_at", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FraudEventEntity {

    @Id
    @Column(name = "id", nullable = false, length = 36)
    private String id;

    @Column(name = "claim_id", length = 36)
    private String claimId;

    @Column(name = "purchase_id")
    private String purchaseId;

    @Column(name = "user_id")
    private String userId;

    @Column(name = "merchant_id")
    private String merchantId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 32)
    private FraudEventType eventType;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false, length = 16)
    private FraudSeverity severity;

    @Column(name = "description", length = 1000)
    private String description;

    @Column(name = "metadata", columnDefinition = "TEXT")
    private String metadata;

    @Column(name = "verification_id", length = 36)
    private String verificationId;

    @Column(name = "resolved", nullable = false)
    private boolean resolved;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "resolved_by")
    private String resolvedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
