package com.slipsafe.claims;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the receipt claims service. Provides:
 * <ul>
 *   <li>Claim issuance with signed, PIN-protected portable credentials</li>
 *   <li>Merchant verification, hold and single-shot redemption</li>
 *   <li>Verification audit log and rule-based fraud events (PostgreSQL, Kafka)</li>
 *   <li>REST API and OpenAPI docs at /swagger-ui/index.html</li>
 * </ul>
 */
@SpringBootApplication
public class ClaimsServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClaimsServiceApplication.class, args);
    }
}
