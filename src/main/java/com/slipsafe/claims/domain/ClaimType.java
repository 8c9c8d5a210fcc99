package com.slipsafe.claims.domain;

import com.slipsafe.claims.api.InvalidClaimTypeException;

import java.util.Locale;

/**
 * What the consumer intends to do with the purchase at the merchant.
 */
public enum ClaimType {
    RETURN,
    WARRANTY,
    EXCHANGE;

    /**
     * Parses the wire value case-insensitively ("return", "WARRANTY"...).
     *
     * @throws InvalidClaimTypeException for null, blank or unknown values
     */
    public static ClaimType parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidClaimTypeException("claimType is required");
        }
        try {
            return ClaimType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidClaimTypeException("Unsupported claimType: " + value);
        }
    }
}
