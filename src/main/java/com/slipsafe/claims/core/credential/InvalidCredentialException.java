package com.slipsafe.claims.core.credential;

/**
 * The presented credential failed signature, issuer or schema checks. Reported to callers as an
 * {@code INVALID} verification status, never as an HTTP error.
 */
public class InvalidCredentialException extends Exception {

    public InvalidCredentialException(String message) {
        super(message);
    }

    public InvalidCredentialException(String message, Throwable cause) {
        super(message, cause);
    }
}
