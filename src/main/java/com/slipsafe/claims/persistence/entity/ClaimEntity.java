package com.slipsafe.claims.persistence.entity;

import com.slipsafe.claims.domain.ClaimState;
import com.slipsafe.claims.domain.ClaimSummary;
import com.slipsafe.claims.domain.ClaimType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Persistent entity for claims. State changes after issuance go through the conditional updates on
 * {@code ClaimRepository}; entities are never saved back after a state change.
 */
@Entity
@Table(name = "claims", indexes = {
    @Index(name = "idx_claim_code", columnList = "claim_code", unique = true),
    @Index(name = "idx_claim_purchase_type", columnList = "purchase_id, claim_type"),
    @Index(name = "idx_claim_user", columnList = "user_id"),
    @Index(name = "idx_claim_state", columnList = "state")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClaimEntity {

    @Id
    @Column(name = "id", nullable = false, length = 36)
    private String id;

    @Column(name = "claim_code", nullable = false, unique = true, length = 32)
    private String claimCode;

    @ToString.Exclude
    @Column(name = "pin", nullable = false, length = 6)
    private String pin;

    @Column(name = "purchase_id", nullable = false)
    private String purchaseId;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "claim_type", nullable = false, length = 16)
    private ClaimType claimType;

    @Column(name = "original_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal originalAmount;

    @Column(name = "redeemed_amount", precision = 19, scale = 2)
    private BigDecimal redeemedAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 16)
    private ClaimState state;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "redeemed_at")
    private Instant redeemedAt;

    @Column(name = "redeemed_by_merchant_id")
    private String redeemedByMerchantId;

    @Column(name = "redeemed_by_user_id")
    private String redeemedByUserId;

    @ToString.Exclude
    @Column(name = "qr_code_data", nullable = false, columnDefinition = "TEXT")
    private String qrCodeData;

    @ToString.Exclude
    @Column(name = "credential", nullable = false, columnDefinition = "TEXT")
    private String credential;

    @Column(name = "merchant_name", nullable = false)
    private String merchantName;

    @Column(name = "purchase_date", nullable = false)
    private LocalDate purchaseDate;

    @Column(name = "purchase_fingerprint", nullable = false, length = 64)
    private String purchaseFingerprint;

    /** Registered merchant whose business name matches the purchase; null for unregistered stores. */
    @Column(name = "origin_merchant_id")
    private String originMerchantId;

    /** {@code purchaseId:claimType} while the claim is open, cleared once it is terminal. At most one open claim per slot. */
    @Column(name = "open_slot", unique = true, length = 300)
    private String openSlot;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public static String openSlotOf(String purchaseId, ClaimType claimType) {
        return purchaseId + ":" + claimType.name();
    }

    /** Open claim whose deadline has passed but which has not been written as EXPIRED yet. */
    public boolean isLapsed(Instant now) {
        return !state.isTerminal() && !now.isBefore(expiresAt);
    }

    public ClaimState effectiveState(Instant now) {
        return isLapsed(now) ? ClaimState.EXPIRED : state;
    }

    public ClaimSummary toSummary(Instant now) {
        ClaimState effective = effectiveState(now);
        return ClaimSummary.builder()
                .claimId(id)
                .claimCode(claimCode)
                .claimType(claimType)
                .state(effective)
                .merchantName(merchantName)
                .purchaseDate(purchaseDate)
                .originalAmount(originalAmount)
                .redeemedAmount(redeemedAmount)
                .expiresAt(expiresAt)
                .redeemedAt(redeemedAt)
                .expired(effective == ClaimState.EXPIRED)
                .used(effective == ClaimState.REDEEMED || effective == ClaimState.PARTIAL
                        || effective == ClaimState.REFUSED)
                .build();
    }
}
