package com.slipsafe.claims.messaging;

import com.slipsafe.claims.domain.ClaimState;
import com.slipsafe.claims.domain.ClaimType;
import com.slipsafe.claims.persistence.entity.ClaimEntity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ClaimEventProducerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private KafkaTemplate<String, ClaimEvent> kafkaTemplate;

    private ClaimEventProducer producer;

    @BeforeEach
    void setUp() {
        producer = new ClaimEventProducer(kafkaTemplate, Clock.fixed(NOW, ZoneOffset.UTC));
        ReflectionTestUtils.setField(producer, "topic", "claim-events");
        ReflectionTestUtils.setField(producer, "enabled", true);
    }

    private static ClaimEntity claim() {
        return ClaimEntity.builder()
                .id("c1")
                .claimCode("ABCDEFGHJKLMNPQR")
                .pin("004512")
                .purchaseId("p1")
                .userId("u1")
                .claimType(ClaimType.RETURN)
                .originalAmount(new BigDecimal("150.00"))
                .state(ClaimState.ISSUED)
                .credential("secret.jwt.value")
                .build();
    }

    @Test
    void publishTransition_keysByClaimCode() {
        CompletableFuture<SendResult<String, ClaimEvent>> future = new CompletableFuture<>();
        when(kafkaTemplate.send(eq("claim-events"), eq("ABCDEFGHJKLMNPQR"), any(ClaimEvent.class))).thenReturn(future);

        producer.publishTransition(claim(), ClaimState.PARTIAL, new BigDecimal("75.00"), "m-acme", "staff-1");

        ArgumentCaptor<ClaimEvent> event = ArgumentCaptor.forClass(ClaimEvent.class);
        verify(kafkaTemplate).send(eq("claim-events"), eq("ABCDEFGHJKLMNPQR"), event.capture());
        assertThat(event.getValue().getEventType()).isEqualTo(ClaimEventProducer.CLAIM_PARTIALLY_REDEEMED);
        assertThat(event.getValue().getState()).isEqualTo(ClaimState.PARTIAL);
        assertThat(event.getValue().getRedeemedAmount()).isEqualByComparingTo("75.00");
        assertThat(event.getValue().getTimestamp()).isEqualTo(NOW);
        assertThat(event.getValue().toString()).doesNotContain("004512").doesNotContain("secret.jwt.value");
    }

    @Test
    void send_brokerFailureIsSwallowed() {
        when(kafkaTemplate.send(anyString(), anyString(), any(ClaimEvent.class)))
                .thenThrow(new IllegalStateException("producer closed"));

        producer.publishIssued(claim());

        verify(kafkaTemplate).send(anyString(), anyString(), any(ClaimEvent.class));
    }

    @Test
    void disabled_publishesNothing() {
        ReflectionTestUtils.setField(producer, "enabled", false);

        producer.publishIssued(claim());

        verify(kafkaTemplate, never()).send(anyString(), anyString(), any(ClaimEvent.class));
    }

    @Test
    void eventTypeFor_mapsEveryState() {
        assertThat(ClaimEventProducer.eventTypeFor(ClaimState.PENDING)).isEqualTo(ClaimEventProducer.CLAIM_HELD);
        assertThat(ClaimEventProducer.eventTypeFor(ClaimState.REDEEMED)).isEqualTo(ClaimEventProducer.CLAIM_REDEEMED);
        assertThat(ClaimEventProducer.eventTypeFor(ClaimState.REFUSED)).isEqualTo(ClaimEventProducer.CLAIM_REFUSED);
        assertThat(ClaimEventProducer.eventTypeFor(ClaimState.EXPIRED)).isEqualTo(ClaimEventProducer.CLAIM_EXPIRED);
        assertThat(ClaimEventProducer.eventTypeFor(ClaimState.ISSUED)).isEqualTo(ClaimEventProducer.CLAIM_ISSUED);
    }
}
