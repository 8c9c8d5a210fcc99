package com.slipsafe.claims.core;

import com.slipsafe.claims.api.IssuanceInProgressException;
import com.slipsafe.claims.api.NotOwnerException;
import com.slipsafe.claims.api.PurchaseNotFoundException;
import com.slipsafe.claims.compliance.ClaimAuditLogger;
import com.slipsafe.claims.core.credential.ClaimCredential;
import com.slipsafe.claims.core.credential.ClaimCredentialSigner;
import com.slipsafe.claims.core.credential.PurchaseFingerprint;
import com.slipsafe.claims.domain.ClaimState;
import com.slipsafe.claims.domain.ClaimType;
import com.slipsafe.claims.domain.IssuedClaim;
import com.slipsafe.claims.domain.Purchase;
import com.slipsafe.claims.ledger.MerchantDirectory;
import com.slipsafe.claims.ledger.PurchaseLedger;
import com.slipsafe.claims.messaging.ClaimEventProducer;
import com.slipsafe.claims.persistence.entity.ClaimEntity;
import com.slipsafe.claims.persistence.repository.ClaimRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Mints claims for purchases. Issuance is idempotent per (purchase, claim type): while an open,
 * unexpired claim exists it is returned as-is instead of minting a second one.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClaimIssuer {

    private static final int MAX_CODE_ATTEMPTS = 5;

    private final PurchaseLedger purchaseLedger;
    private final MerchantDirectory merchantDirectory;
    private final ClaimRepository claimRepository;
    private final ClaimCodeGenerator codeGenerator;
    private final ClaimCredentialSigner credentialSigner;
    private final IssuanceGuard issuanceGuard;
    private final ClaimEventProducer eventProducer;
    private final ClaimAuditLogger auditLogger;
    private final Clock clock;

    @Value("${claims.issuance.validity-days:90}")
    private int validityDays;

    @Value("${claims.verifier.base-url:http://localhost:8080}")
    private String verifierBaseUrl;

    /**
     * @throws com.slipsafe.claims.api.InvalidClaimTypeException unknown claim type
     * @throws PurchaseNotFoundException                         unknown purchase
     * @throws NotOwnerException                                 purchase owned by another user
     * @throws IssuanceInProgressException                       a concurrent request is minting the same claim
     */
    public IssuedClaim issueClaim(String purchaseId, String userId, String claimType) {
        ClaimType type = ClaimType.parse(claimType);
        Purchase purchase = purchaseLedger.findPurchase(purchaseId)
                .orElseThrow(() -> new PurchaseNotFoundException(purchaseId));
        if (userId == null || !userId.equals(purchase.getUserId())) {
            log.warn("Claim issuance refused: purchaseId={} requestedBy={} not owner", purchaseId, userId);
            throw new NotOwnerException("Purchase " + purchaseId + " does not belong to user " + userId);
        }

        Optional<ClaimEntity> existing = findReusable(purchaseId, type);
        if (existing.isPresent()) {
            return reuse(existing.get());
        }

        try (IssuanceGuard.Lock lock = issuanceGuard.acquire(purchaseId, type)) {
            existing = findReusable(purchaseId, type);
            if (existing.isPresent()) {
                return reuse(existing.get());
            }
            if (lock.getOutcome() == IssuanceGuard.Outcome.HELD_ELSEWHERE) {
                throw new IssuanceInProgressException(purchaseId, type.name());
            }
            int lapsed = claimRepository.expireLapsed(purchaseId, type, clock.instant());
            if (lapsed > 0) {
                log.info("Expired {} lapsed claim(s) before reissue: purchaseId={} type={}", lapsed, purchaseId, type);
            }
            ClaimEntity claim;
            try {
                claim = claimRepository.save(mint(purchase, userId, type));
            } catch (DataIntegrityViolationException e) {
                // open slot taken by a concurrent issuer
                log.warn("Claim insert rejected for purchaseId={} type={}: {}", purchaseId, type, e.getMostSpecificCause().getMessage());
                existing = findReusable(purchaseId, type);
                if (existing.isPresent()) {
                    return reuse(existing.get());
                }
                throw new IssuanceInProgressException(purchaseId, type.name());
            }
            auditLogger.logIssued(claim, false);
            eventProducer.publishIssued(claim);
            return toIssuedClaim(claim, false);
        }
    }

    private Optional<ClaimEntity> findReusable(String purchaseId, ClaimType type) {
        List<ClaimEntity> open = claimRepository.findReusable(purchaseId, type, ClaimState.OPEN_STATES, clock.instant());
        return open.stream().findFirst();
    }

    private IssuedClaim reuse(ClaimEntity claim) {
        log.debug("Reusing open claim: claimId={} purchaseId={} type={}", claim.getId(), claim.getPurchaseId(), claim.getClaimType());
        auditLogger.logIssued(claim, true);
        return toIssuedClaim(claim, true);
    }

    private ClaimEntity mint(Purchase purchase, String userId, ClaimType type) {
        Instant now = clock.instant();
        Instant expiresAt = now.plus(Duration.ofDays(validityDays));
        BigDecimal amount = purchase.getTotalAmount().setScale(2, RoundingMode.HALF_UP);
        String fingerprint = PurchaseFingerprint.of(purchase.getMerchantName(), purchase.getPurchaseDate(), amount);
        String claimCode = uniqueClaimCode();

        String credential = credentialSigner.sign(ClaimCredential.builder()
                .claimCode(claimCode)
                .merchantName(purchase.getMerchantName())
                .purchaseDate(purchase.getPurchaseDate())
                .amount(amount)
                .fingerprint(fingerprint)
                .claimType(type)
                .issuedAt(now)
                .expiresAt(expiresAt)
                .build());

        return ClaimEntity.builder()
                .id(UUID.randomUUID().toString())
                .claimCode(claimCode)
                .pin(codeGenerator.newPin())
                .purchaseId(purchase.getId())
                .userId(userId)
                .claimType(type)
                .originalAmount(amount)
                .state(ClaimState.ISSUED)
                .expiresAt(expiresAt)
                .qrCodeData(qrPayload(credential))
                .credential(credential)
                .merchantName(purchase.getMerchantName())
                .purchaseDate(purchase.getPurchaseDate())
                .purchaseFingerprint(fingerprint)
                .openSlot(ClaimEntity.openSlotOf(purchase.getId(), type))
                .originMerchantId(merchantDirectory.findMerchantIdByName(purchase.getMerchantName()).orElse(null))
                .createdAt(now)
                .build();
    }

    private String uniqueClaimCode() {
        for (int attempt = 0; attempt < MAX_CODE_ATTEMPTS; attempt++) {
            String code = codeGenerator.newClaimCode();
            if (!claimRepository.existsByClaimCode(code)) {
                return code;
            }
            log.warn("Claim code collision on attempt {}", attempt + 1);
        }
        throw new IllegalStateException("Could not generate a unique claim code after " + MAX_CODE_ATTEMPTS + " attempts");
    }

    private String qrPayload(String credential) {
        String base = verifierBaseUrl.endsWith("/") ? verifierBaseUrl.substring(0, verifierBaseUrl.length() - 1) : verifierBaseUrl;
        return base + "/claim/" + credential;
    }

    private static IssuedClaim toIssuedClaim(ClaimEntity claim, boolean reused) {
        return IssuedClaim.builder()
                .claimId(claim.getId())
                .claimCode(claim.getClaimCode())
                .pin(claim.getPin())
                .qrPayload(claim.getQrCodeData())
                .credential(claim.getCredential())
                .expiresAt(claim.getExpiresAt())
                .claimType(claim.getClaimType())
                .state(claim.getState())
                .reused(reused)
                .build();
    }
}
