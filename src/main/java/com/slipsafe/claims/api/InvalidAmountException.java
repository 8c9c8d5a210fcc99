package com.slipsafe.claims.api;

import lombok.Getter;

/**
 * Thrown when a refund amount is missing, non-positive, or inconsistent with the claim.
 * When the check ran against a stored claim, {@code verificationId} points at the audit row
 * that recorded the rejection.
 */
@Getter
public class InvalidAmountException extends RuntimeException {

    private final String verificationId;

    public InvalidAmountException(String message) {
        this(message, null);
    }

    public InvalidAmountException(String message, String verificationId) {
        super(message);
        this.verificationId = verificationId;
    }
}
