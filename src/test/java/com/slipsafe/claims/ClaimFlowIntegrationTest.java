package com.slipsafe.claims;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.slipsafe.claims.persistence.entity.MerchantEntity;
import com.slipsafe.claims.persistence.entity.MerchantUserEntity;
import com.slipsafe.claims.persistence.entity.PurchaseEntity;
import com.slipsafe.claims.persistence.repository.MerchantRepository;
import com.slipsafe.claims.persistence.repository.MerchantUserRepository;
import com.slipsafe.claims.persistence.repository.PurchaseRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Disabled;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.kafka.test.context.EmbeddedKafka;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Integration test: issue, verify and redeem a claim end to end.
 * Uses Embedded Kafka and Testcontainers PostgreSQL and Redis. Requires Docker.
 * Run with: mvn test -DincludeTags=integration (and ensure Docker is available).
 */
@Tag("integration")
@Disabled("Requires Docker; remove @Disabled or use -DincludeTags=integration with Docker")
@SpringBootTest(classes = ClaimsServiceApplication.class, properties = "claims.kafka.enabled=true")
@AutoConfigureMockMvc
@EmbeddedKafka(partitions = 1, topics = { "claim-events", "fraud-events" },
        bootstrapServersProperty = "spring.kafka.bootstrap-servers")
@Testcontainers
class ClaimFlowIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>(DockerImageName.parse("postgres:16-alpine"));

    @Container
    static GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private PurchaseRepository purchaseRepository;

    @Autowired
    private MerchantRepository merchantRepository;

    @Autowired
    private MerchantUserRepository merchantUserRepository;

    private String purchaseId;

    @DynamicPropertySource
    static void containerProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.data.redis.host", redis::getHost);
        registry.add("spring.data.redis.port", () -> redis.getMappedPort(6379).toString());
    }

    @BeforeEach
    void seed() {
        purchaseId = "p-" + UUID.randomUUID();
        purchaseRepository.save(PurchaseEntity.builder()
                .id(purchaseId)
                .userId("u-int")
                .merchant("Integration Hardware")
                .purchaseDate(LocalDate.now().minusDays(3))
                .totalAmount(new BigDecimal("150.00"))
                .returnBy(LocalDate.now().plusDays(27))
                .build());
        if (!merchantRepository.existsById("m-int")) {
            merchantRepository.save(MerchantEntity.builder().id("m-int").businessName("Integration Hardware").active(true).build());
            merchantUserRepository.save(MerchantUserEntity.builder().id("s-int").merchantId("m-int").fullName("Int Staff")
                    .role(MerchantUserEntity.Role.STAFF).active(true).build());
        }
    }

    @Test
    @DisplayName("Issued claim verifies, redeems once, then reports ALREADY_REDEEMED")
    void issueVerifyRedeemOnce() throws Exception {
        String issued = mockMvc.perform(post("/api/v1/claims")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"purchaseId\":\"" + purchaseId + "\",\"userId\":\"u-int\",\"claimType\":\"RETURN\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.reused").value(false))
                .andReturn().getResponse().getContentAsString();
        JsonNode claim = objectMapper.readTree(issued);
        String code = claim.get("claimCode").asText();
        String pin = claim.get("pin").asText();
        String credential = claim.get("credential").asText();

        mockMvc.perform(post("/api/v1/claims/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"claimCode\":\"" + code + "\",\"pin\":\"" + pin + "\",\"credential\":\"" + credential
                                + "\",\"merchantId\":\"m-int\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("MATCH"))
                .andExpect(jsonPath("$.comparison.eligible").value(true));

        String redeem = "{\"claimCode\":\"" + code + "\",\"pin\":\"" + pin
                + "\",\"merchantId\":\"m-int\",\"merchantUserId\":\"s-int\"}";
        mockMvc.perform(post("/api/v1/claims/redeem").contentType(MediaType.APPLICATION_JSON).content(redeem))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.newState").value("REDEEMED"))
                .andExpect(jsonPath("$.redeemedAmount").value(150.0));
        mockMvc.perform(post("/api/v1/claims/redeem").contentType(MediaType.APPLICATION_JSON).content(redeem))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ALREADY_REDEEMED"))
                .andExpect(jsonPath("$.newState").value("REDEEMED"));
    }

    @Test
    @DisplayName("Issuing twice for the same purchase and type returns the same claim")
    void issueIsIdempotent() throws Exception {
        String body = "{\"purchaseId\":\"" + purchaseId + "\",\"userId\":\"u-int\",\"claimType\":\"WARRANTY\"}";
        String first = mockMvc.perform(post("/api/v1/claims").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        String code = objectMapper.readTree(first).get("claimCode").asText();

        mockMvc.perform(post("/api/v1/claims").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.reused").value(true))
                .andExpect(jsonPath("$.claimCode").value(code));
    }
}
