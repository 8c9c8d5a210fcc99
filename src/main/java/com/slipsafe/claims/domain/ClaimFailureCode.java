package com.slipsafe.claims.domain;

/**
 * Machine-readable reason attached to any verification, hold or redemption that did not succeed.
 */
public enum ClaimFailureCode {
    /** Unknown claim code. */
    NOT_FOUND,
    /** Purchase belongs to another user. */
    NOT_OWNER,
    /** Scanned credential failed signature or schema checks. */
    INVALID_CREDENTIAL,
    /** Credential is authentic but does not describe the stored claim. */
    CREDENTIAL_MISMATCH,
    EXPIRED,
    /** Claim already reached a terminal state. */
    ALREADY_TERMINAL,
    PIN_MISMATCH,
    /** Too many failed PIN attempts in the trailing window. */
    RATE_LIMITED,
    INVALID_AMOUNT
}
