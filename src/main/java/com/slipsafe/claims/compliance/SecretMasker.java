package com.slipsafe.claims.compliance;

/**
 * Redacts claim secrets so they are safe to include in logs.
 * PINs and signed credentials must never appear in clear; claim codes keep a short prefix for correlation.
 */
public final class SecretMasker {

    private static final String MASKED_PIN = "******";
    private static final String MASKED_TOKEN = "jwt_***";
    private static final int CODE_VISIBLE_PREFIX = 4;

    private SecretMasker() {}

    /** Returns a safe-to-log value for a PIN (e.g. "042917" -> "******"). */
    public static String maskPin(String pin) {
        if (pin == null || pin.isBlank()) return null;
        return MASKED_PIN;
    }

    /** Returns a safe-to-log value for a signed credential or QR payload. */
    public static String maskCredential(String credential) {
        if (credential == null || credential.isBlank()) return null;
        return MASKED_TOKEN;
    }

    /** Keeps the first four characters of a claim code (e.g. "K7QM2XPA9RTW3HBD" -> "K7QM************"). */
    public static String maskClaimCode(String claimCode) {
        if (claimCode == null || claimCode.isBlank()) return null;
        if (claimCode.length() <= CODE_VISIBLE_PREFIX) return "*".repeat(claimCode.length());
        return claimCode.substring(0, CODE_VISIBLE_PREFIX) + "*".repeat(claimCode.length() - CODE_VISIBLE_PREFIX);
    }
}
