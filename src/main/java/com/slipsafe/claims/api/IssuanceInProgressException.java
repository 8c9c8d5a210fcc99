package com.slipsafe.claims.api;

/**
 * Another request is currently issuing a claim for the same purchase and type.
 * Handler returns HTTP 409; the client may retry and will then receive the existing claim.
 */
public class IssuanceInProgressException extends RuntimeException {

    public IssuanceInProgressException(String purchaseId, String claimType) {
        super("Claim issuance already in progress for purchase " + purchaseId + " (" + claimType + ")");
    }
}
