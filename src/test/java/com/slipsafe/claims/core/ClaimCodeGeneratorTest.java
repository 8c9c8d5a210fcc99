package com.slipsafe.claims.core;

import org.junit.jupiter.api.Test;

import java.security.SecureRandom;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ClaimCodeGeneratorTest {

    private final ClaimCodeGenerator generator = new ClaimCodeGenerator(new SecureRandom());

    @Test
    void newClaimCode_usesUnambiguousAlphabet() {
        for (int i = 0; i < 200; i++) {
            String code = generator.newClaimCode();
            assertThat(code).hasSize(16).matches("[A-HJ-NP-Z2-9]+");
        }
    }

    @Test
    void newClaimCode_doesNotRepeat() {
        Set<String> codes = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            codes.add(generator.newClaimCode());
        }
        assertThat(codes).hasSize(1000);
    }

    @Test
    void newPin_isSixDigitsWithLeadingZeros() {
        ClaimCodeGenerator lowRoller = new ClaimCodeGenerator(new SecureRandom() {
            @Override
            public int nextInt(int bound) {
                return 42;
            }
        });
        assertThat(lowRoller.newPin()).isEqualTo("000042");
        assertThat(generator.newPin()).matches("\\d{6}");
    }
}
