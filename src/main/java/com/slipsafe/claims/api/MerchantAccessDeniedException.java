package com.slipsafe.claims.api;

/**
 * Thrown when the acting merchant or staff member is unknown, inactive, or not linked to each other.
 * Handler returns HTTP 403.
 */
public class MerchantAccessDeniedException extends RuntimeException {

    public MerchantAccessDeniedException(String message) {
        super(message);
    }
}
