package com.slipsafe.claims.api;

/**
 * Thrown when the purchase ledger has no purchase with the given id. Handler returns HTTP 404.
 */
public class PurchaseNotFoundException extends RuntimeException {

    public PurchaseNotFoundException(String purchaseId) {
        super("Purchase not found: " + purchaseId);
    }
}
