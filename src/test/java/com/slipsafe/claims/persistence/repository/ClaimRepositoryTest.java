package com.slipsafe.claims.persistence.repository;

import com.slipsafe.claims.domain.ClaimState;
import com.slipsafe.claims.domain.ClaimType;
import com.slipsafe.claims.persistence.entity.ClaimEntity;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
class ClaimRepositoryTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Autowired
    private ClaimRepository claimRepository;

    private ClaimEntity saveClaim(String id, String code, ClaimState state, Instant expiresAt) {
        return saveClaim(id, code, state, expiresAt, null);
    }

    private ClaimEntity saveClaim(String id, String code, ClaimState state, Instant expiresAt, String openSlot) {
        return claimRepository.saveAndFlush(ClaimEntity.builder()
                .id(id)
                .claimCode(code)
                .pin("004512")
                .purchaseId("p1")
                .userId("u1")
                .claimType(ClaimType.RETURN)
                .originalAmount(new BigDecimal("150.00"))
                .state(state)
                .expiresAt(expiresAt)
                .qrCodeData("https://verify.example.test/claim/t")
                .credential("t")
                .merchantName("Acme Hardware")
                .purchaseDate(LocalDate.of(2026, 2, 20))
                .purchaseFingerprint("f".repeat(64))
                .openSlot(openSlot)
                .createdAt(NOW.minus(Duration.ofDays(1)))
                .build());
    }

    @Test
    void settle_succeedsOnlyOnce() {
        saveClaim("c1", "ABCDEFGHJKLMNPQR", ClaimState.ISSUED, NOW.plus(Duration.ofDays(30)));

        int first = claimRepository.settle("c1", ClaimState.REDEEMED, new BigDecimal("150.00"), "m1", "s1", NOW);
        int second = claimRepository.settle("c1", ClaimState.PARTIAL, new BigDecimal("10.00"), "m2", "s2", NOW);

        assertThat(first).isEqualTo(1);
        assertThat(second).isZero();
        ClaimEntity stored = claimRepository.findById("c1").orElseThrow();
        assertThat(stored.getState()).isEqualTo(ClaimState.REDEEMED);
        assertThat(stored.getRedeemedAmount()).isEqualByComparingTo("150.00");
        assertThat(stored.getRedeemedByMerchantId()).isEqualTo("m1");
        assertThat(stored.getRedeemedAt()).isEqualTo(NOW);
    }

    @Test
    void expire_doesNotOverrideSettledClaim() {
        saveClaim("c1", "ABCDEFGHJKLMNPQR", ClaimState.REFUSED, NOW.minus(Duration.ofDays(1)));

        assertThat(claimRepository.expire("c1", NOW)).isZero();
        assertThat(claimRepository.findById("c1").orElseThrow().getState()).isEqualTo(ClaimState.REFUSED);
    }

    @Test
    void hold_onlyMovesIssuedClaims() {
        saveClaim("c1", "ABCDEFGHJKLMNPQR", ClaimState.ISSUED, NOW.plus(Duration.ofDays(30)));

        assertThat(claimRepository.hold("c1", NOW)).isEqualTo(1);
        assertThat(claimRepository.hold("c1", NOW)).isZero();
        assertThat(claimRepository.findById("c1").orElseThrow().getState()).isEqualTo(ClaimState.PENDING);
        assertThat(claimRepository.settle("c1", ClaimState.REDEEMED, new BigDecimal("150.00"), "m1", "s1", NOW)).isEqualTo(1);
    }

    @Test
    void findReusable_skipsTerminalAndLapsedClaims() {
        saveClaim("c-lapsed", "AAAAAAAAAAAAAAAA", ClaimState.ISSUED, NOW.minus(Duration.ofMinutes(1)));
        saveClaim("c-used", "BBBBBBBBBBBBBBBB", ClaimState.REDEEMED, NOW.plus(Duration.ofDays(30)));
        saveClaim("c-open", "CCCCCCCCCCCCCCCC", ClaimState.PENDING, NOW.plus(Duration.ofDays(30)));

        assertThat(claimRepository.findReusable("p1", ClaimType.RETURN, ClaimState.OPEN_STATES, NOW))
                .extracting(ClaimEntity::getId)
                .containsExactly("c-open");
        assertThat(claimRepository.findReusable("p1", ClaimType.WARRANTY, ClaimState.OPEN_STATES, NOW)).isEmpty();
    }

    @Test
    void openSlot_rejectsSecondOpenClaimForSamePurchaseAndType() {
        String slot = ClaimEntity.openSlotOf("p1", ClaimType.RETURN);
        saveClaim("c1", "AAAAAAAAAAAAAAAA", ClaimState.ISSUED, NOW.plus(Duration.ofDays(30)), slot);

        assertThatThrownBy(() -> saveClaim("c2", "BBBBBBBBBBBBBBBB", ClaimState.ISSUED, NOW.plus(Duration.ofDays(30)), slot))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void settle_releasesOpenSlot() {
        String slot = ClaimEntity.openSlotOf("p1", ClaimType.RETURN);
        saveClaim("c1", "AAAAAAAAAAAAAAAA", ClaimState.ISSUED, NOW.plus(Duration.ofDays(30)), slot);

        claimRepository.settle("c1", ClaimState.REDEEMED, new BigDecimal("150.00"), "m1", "s1", NOW);

        assertThat(claimRepository.findById("c1").orElseThrow().getOpenSlot()).isNull();
        saveClaim("c2", "BBBBBBBBBBBBBBBB", ClaimState.ISSUED, NOW.plus(Duration.ofDays(30)), slot);
        assertThat(claimRepository.findById("c2")).isPresent();
    }

    @Test
    void expireLapsed_writesExpiredAndReleasesSlotOnlyForLapsedClaims() {
        saveClaim("c-lapsed", "AAAAAAAAAAAAAAAA", ClaimState.PENDING, NOW.minus(Duration.ofMinutes(1)),
                ClaimEntity.openSlotOf("p1", ClaimType.RETURN));
        saveClaim("c-open", "BBBBBBBBBBBBBBBB", ClaimState.ISSUED, NOW.plus(Duration.ofDays(30)),
                ClaimEntity.openSlotOf("p1", ClaimType.WARRANTY));

        assertThat(claimRepository.expireLapsed("p1", ClaimType.RETURN, NOW)).isEqualTo(1);
        assertThat(claimRepository.expireLapsed("p1", ClaimType.WARRANTY, NOW)).isZero();

        ClaimEntity lapsed = claimRepository.findById("c-lapsed").orElseThrow();
        assertThat(lapsed.getState()).isEqualTo(ClaimState.EXPIRED);
        assertThat(lapsed.getOpenSlot()).isNull();
        assertThat(claimRepository.findById("c-open").orElseThrow().getOpenSlot()).isEqualTo("p1:WARRANTY");
    }
}
