package com.slipsafe.claims.config;

import com.slipsafe.claims.core.credential.ClaimCredentialSigner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Builds the credential signer from configuration. The secret must be at least 32 bytes (HS256).
 */
@Slf4j
@Configuration
public class CredentialConfig {

    @Bean
    public ClaimCredentialSigner claimCredentialSigner(
            @Value("${claims.credential.secret}") String secret,
            @Value("${claims.credential.issuer:receipt-claims}") String issuer,
            Clock clock) {
        log.info("Claim credential signer initialized: algorithm=HS256 issuer={}", issuer);
        return new ClaimCredentialSigner(secret, issuer, clock);
    }
}
