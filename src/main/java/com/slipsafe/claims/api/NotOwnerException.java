package com.slipsafe.claims.api;

/**
 * Thrown when a user asks for a claim on a purchase they do not own. Handler returns HTTP 403.
 */
public class NotOwnerException extends RuntimeException {

    public NotOwnerException(String message) {
        super(message);
    }
}
