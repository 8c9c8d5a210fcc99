package com.slipsafe.claims.messaging;

import com.slipsafe.claims.domain.ClaimState;
import com.slipsafe.claims.persistence.entity.ClaimEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes claim lifecycle events keyed by claim code, so all events of a claim land on one partition.
 * Publishing never fails the calling request.
 */
@Slf4j
@Component
public class ClaimEventProducer {

    public static final String CLAIM_ISSUED = "CLAIM_ISSUED";
    public static final String CLAIM_HELD = "CLAIM_HELD";
    public static final String CLAIM_REDEEMED = "CLAIM_REDEEMED";
    public static final String CLAIM_PARTIALLY_REDEEMED = "CLAIM_PARTIALLY_REDEEMED";
    public static final String CLAIM_REFUSED = "CLAIM_REFUSED";
    public static final String CLAIM_EXPIRED = "CLAIM_EXPIRED";

    private final KafkaTemplate<String, ClaimEvent> claimEventKafkaTemplate;
    private final Clock clock;

    @Value("${claims.kafka.topic.claim-events:claim-events}")
    private String topic;

    @Value("${claims.kafka.enabled:true}")
    private boolean enabled;

    public ClaimEventProducer(KafkaTemplate<String, ClaimEvent> claimEventKafkaTemplate, Clock clock) {
        this.claimEventKafkaTemplate = claimEventKafkaTemplate;
        this.clock = clock;
    }

    public void publishIssued(ClaimEntity claim) {
        send(event(CLAIM_ISSUED, claim, claim.getState(), null, null, null));
    }

    /** Publishes the event matching {@code newState} after a transition performed by this instance. */
    public void publishTransition(ClaimEntity claim, ClaimState newState, BigDecimal redeemedAmount,
                                  String merchantId, String merchantUserId) {
        send(event(eventTypeFor(newState), claim, newState, redeemedAmount, merchantId, merchantUserId));
    }

    static String eventTypeFor(ClaimState state) {
        switch (state) {
            case PENDING:
                return CLAIM_HELD;
            case REDEEMED:
                return CLAIM_REDEEMED;
            case PARTIAL:
                return CLAIM_PARTIALLY_REDEEMED;
            case REFUSED:
                return CLAIM_REFUSED;
            case EXPIRED:
                return CLAIM_EXPIRED;
            default:
                return CLAIM_ISSUED;
        }
    }

    private ClaimEvent event(String eventType, ClaimEntity claim, ClaimState state, BigDecimal redeemedAmount,
                             String merchantId, String merchantUserId) {
        return ClaimEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(eventType)
                .claimId(claim.getId())
                .claimCode(claim.getClaimCode())
                .purchaseId(claim.getPurchaseId())
                .userId(claim.getUserId())
                .claimType(claim.getClaimType())
                .state(state)
                .originalAmount(claim.getOriginalAmount())
                .redeemedAmount(redeemedAmount)
                .merchantId(merchantId)
                .merchantUserId(merchantUserId)
                .expiresAt(claim.getExpiresAt())
                .timestamp(clock.instant())
                .build();
    }

    private void send(ClaimEvent event) {
        if (!enabled) {
            log.debug("Kafka disabled; skipping claim event {} for claimId={}", event.getEventType(), event.getClaimId());
            return;
        }
        String key = event.getClaimCode();
        try {
            CompletableFuture<SendResult<String, ClaimEvent>> future = claimEventKafkaTemplate.send(topic, key, event);
            future.whenComplete((result, ex) -> {
                if (ex != null) {
                    log.error("Failed to publish claim event eventId={} type={} claimId={}",
                            event.getEventId(), event.getEventType(), event.getClaimId(), ex);
                } else {
                    log.debug("Published claim event eventId={} type={} partition={}", event.getEventId(),
                            event.getEventType(), result != null ? result.getRecordMetadata().partition() : null);
                }
            });
        } catch (Exception e) {
            log.error("Could not hand claim event to Kafka eventId={} type={} claimId={}",
                    event.getEventId(), event.getEventType(), event.getClaimId(), e);
        }
    }
}
