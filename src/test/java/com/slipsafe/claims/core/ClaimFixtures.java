package com.slipsafe.claims.core;

import com.slipsafe.claims.core.credential.ClaimCredential;
import com.slipsafe.claims.core.credential.ClaimCredentialSigner;
import com.slipsafe.claims.core.credential.PurchaseFingerprint;
import com.slipsafe.claims.domain.ClaimState;
import com.slipsafe.claims.domain.ClaimType;
import com.slipsafe.claims.domain.Purchase;
import com.slipsafe.claims.persistence.entity.ClaimEntity;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Shared claim/purchase/credential builders for the core service tests.
 */
final class ClaimFixtures {

    static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
    static final String SECRET = "test-secret-for-claim-credentials-0123456789";
    static final String ISSUER = "receipt-claims";

    static final String CODE = "ABCDEFGHJKLMNPQR";
    static final String PIN = "004512";
    static final String MERCHANT = "Acme Hardware";
    static final LocalDate PURCHASE_DATE = LocalDate.of(2026, 2, 20);
    static final BigDecimal AMOUNT = new BigDecimal("150.00");

    private ClaimFixtures() {
    }

    static ClaimCredentialSigner signer() {
        return new ClaimCredentialSigner(SECRET, ISSUER, CLOCK);
    }

    static Purchase purchase() {
        return Purchase.builder()
                .id("p1")
                .userId("u1")
                .merchantName(MERCHANT)
                .purchaseDate(PURCHASE_DATE)
                .totalAmount(AMOUNT)
                .returnBy(LocalDate.of(2026, 3, 22))
                .warrantyEnds(LocalDate.of(2027, 2, 20))
                .build();
    }

    static ClaimEntity.ClaimEntityBuilder claim() {
        return ClaimEntity.builder()
                .id("c1")
                .claimCode(CODE)
                .pin(PIN)
                .purchaseId("p1")
                .userId("u1")
                .claimType(ClaimType.RETURN)
                .originalAmount(AMOUNT)
                .state(ClaimState.ISSUED)
                .expiresAt(NOW.plus(Duration.ofDays(60)))
                .qrCodeData("https://verify.example.test/claim/x")
                .credential("x")
                .merchantName(MERCHANT)
                .purchaseDate(PURCHASE_DATE)
                .purchaseFingerprint(PurchaseFingerprint.of(MERCHANT, PURCHASE_DATE, AMOUNT))
                .originMerchantId("m-acme")
                .createdAt(NOW.minus(Duration.ofDays(9)));
    }

    static ClaimCredential.ClaimCredentialBuilder credential() {
        return ClaimCredential.builder()
                .claimCode(CODE)
                .merchantName(MERCHANT)
                .purchaseDate(PURCHASE_DATE)
                .amount(AMOUNT)
                .fingerprint(PurchaseFingerprint.of(MERCHANT, PURCHASE_DATE, AMOUNT))
                .claimType(ClaimType.RETURN)
                .issuedAt(NOW.minus(Duration.ofDays(9)))
                .expiresAt(NOW.plus(Duration.ofDays(60)));
    }
}
