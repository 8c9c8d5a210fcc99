package com.slipsafe.claims.api;

/**
 * Thrown when the requested claim type is missing or unknown. Handler returns HTTP 400.
 */
public class InvalidClaimTypeException extends RuntimeException {

    public InvalidClaimTypeException(String message) {
        super(message);
    }
}
