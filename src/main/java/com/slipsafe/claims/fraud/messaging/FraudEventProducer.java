package com.slipsafe.claims.fraud.messaging;

import com.slipsafe.claims.fraud.domain.FraudEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes persisted fraud events to a dedicated topic for review queues and dashboards.
 */
@Slf4j
@Component
public class FraudEventProducer {

    private final KafkaTemplate<String, FraudEvent> fraudEventKafkaTemplate;

    @Value("${claims.kafka.topic.fraud-events:fraud-events}")
    private String topic;

    @Value("${claims.kafka.enabled:true}")
    private boolean enabled;

    public FraudEventProducer(KafkaTemplate<String, FraudEvent> fraudEventKafkaTemplate) {
        this.fraudEventKafkaTemplate = fraudEventKafkaTemplate;
    }

    public void send(FraudEvent event) {
        if (!enabled) return;
        String key = event.getClaimId() != null ? event.getClaimId() : event.getId();
        try {
            CompletableFuture<SendResult<String, FraudEvent>> future = fraudEventKafkaTemplate.send(topic, key, event);
            future.whenComplete((result, ex) -> {
                if (ex != null) log.error("Failed to send fraud event {}", event.getId(), ex);
                else log.debug("Sent fraud event {} partition={}", event.getId(), result != null ? result.getRecordMetadata().partition() : null);
            });
        } catch (Exception e) {
            log.error("Could not hand fraud event {} to Kafka", event.getId(), e);
        }
    }
}
