package com.slipsafe.claims.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Field-by-field comparison between a presented credential and the stored claim, plus the
 * policy eligibility derived from the purchase. Match fields are null when no credential was presented.
 */
@Value
@Builder
public class ClaimComparison {

    boolean credentialPresented;
    Boolean claimCodeMatch;
    Boolean merchantMatch;
    Boolean dateMatch;
    Boolean amountMatch;
    Boolean fingerprintMatch;
    /** Null when the purchase has no return-by date. */
    Boolean withinReturnWindow;
    /** Null when the purchase has no warranty end date. */
    Boolean withinWarranty;
    /** Whether the claim type is covered by the purchase policy today. Informative only. */
    boolean eligible;

    public boolean credentialMatches() {
        return !credentialPresented
                || (Boolean.TRUE.equals(claimCodeMatch)
                && Boolean.TRUE.equals(merchantMatch)
                && Boolean.TRUE.equals(dateMatch)
                && Boolean.TRUE.equals(amountMatch)
                && Boolean.TRUE.equals(fingerprintMatch));
    }
}
