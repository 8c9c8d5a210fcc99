package com.slipsafe.claims.api;

/**
 * Thrown when resolving a fraud event id that does not exist. Handler returns HTTP 404.
 */
public class FraudEventNotFoundException extends RuntimeException {

    public FraudEventNotFoundException(String id) {
        super("Fraud event not found: " + id);
    }
}
