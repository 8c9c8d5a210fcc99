package com.slipsafe.claims.ledger;

import com.slipsafe.claims.domain.Purchase;

import java.util.Optional;

/**
 * Read-only access to purchases digitized by the receipt pipeline. This service never writes purchases.
 */
public interface PurchaseLedger {

    Optional<Purchase> findPurchase(String purchaseId);
}
