package com.slipsafe.claims.ledger;

import com.slipsafe.claims.domain.Purchase;
import com.slipsafe.claims.persistence.entity.PurchaseEntity;
import com.slipsafe.claims.persistence.repository.PurchaseRepository;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Purchase ledger backed by the shared purchases table. Lookups are retried on transient storage
 * failures using the {@code purchase-ledger} Resilience4j instance.
 */
@Slf4j
@Component
public class JpaPurchaseLedger implements PurchaseLedger {

    static final String RETRY_INSTANCE = "purchase-ledger";

    private final PurchaseRepository purchaseRepository;
    private final Retry retry;

    public JpaPurchaseLedger(PurchaseRepository purchaseRepository, RetryRegistry retryRegistry) {
        this.purchaseRepository = purchaseRepository;
        this.retry = retryRegistry.retry(RETRY_INSTANCE);
    }

    @Override
    public Optional<Purchase> findPurchase(String purchaseId) {
        if (purchaseId == null || purchaseId.isBlank()) {
            return Optional.empty();
        }
        Supplier<Optional<PurchaseEntity>> lookup = () -> purchaseRepository.findById(purchaseId);
        Optional<PurchaseEntity> entity = Retry.decorateSupplier(retry, lookup).get();
        log.debug("Purchase lookup: purchaseId={}, found={}", purchaseId, entity.isPresent());
        return entity.map(JpaPurchaseLedger::toPurchase);
    }

    private static Purchase toPurchase(PurchaseEntity entity) {
        return Purchase.builder()
                .id(entity.getId())
                .userId(entity.getUserId())
                .merchantName(entity.getMerchant())
                .purchaseDate(entity.getPurchaseDate())
                .totalAmount(entity.getTotalAmount())
                .returnBy(entity.getReturnBy())
                .warrantyEnds(entity.getWarrantyEnds())
                .build();
    }
}
