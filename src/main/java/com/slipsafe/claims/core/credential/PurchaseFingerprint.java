package com.slipsafe.claims.core.credential;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDate;
import java.util.HexFormat;

/**
 * Hex SHA-256 of {@code merchant|yyyy-MM-dd|amount}, amount at two decimals.
 */
public final class PurchaseFingerprint {

    private PurchaseFingerprint() {}

    public static String of(String merchantName, LocalDate purchaseDate, BigDecimal amount) {
        String canonical = merchantName + "|" + purchaseDate + "|" + amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
