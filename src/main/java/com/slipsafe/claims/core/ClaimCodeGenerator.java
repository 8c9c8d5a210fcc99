package com.slipsafe.claims.core;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;

/**
 * Generates claim codes and PINs with {@link SecureRandom}.
 *
 * <p>Claim codes are 16 symbols over a 32-letter alphabet without 0/O/1/I (80 bits), so guessing is
 * infeasible at the throttled verification rate. PINs are 6 digits with leading zeros allowed; they
 * are only safe because failed PIN attempts are throttled.
 */
@Component
public class ClaimCodeGenerator {

    static final String ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";
    static final int CODE_LENGTH = 16;
    static final int PIN_LENGTH = 6;

    private final SecureRandom random;

    public ClaimCodeGenerator() {
        this(new SecureRandom());
    }

    ClaimCodeGenerator(SecureRandom random) {
        this.random = random;
    }

    public String newClaimCode() {
        StringBuilder code = new StringBuilder(CODE_LENGTH);
        for (int i = 0; i < CODE_LENGTH; i++) {
            code.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return code.toString();
    }

    public String newPin() {
        return String.format("%06d", random.nextInt(1_000_000));
    }
}
