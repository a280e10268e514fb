package org.example.restaurantfieldservice.kafka.producer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.restaurantfieldservice.kafka.dto.EntityChangeMessage;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

@Slf4j
@Service
@RequiredArgsConstructor
public class EntityChangeKafkaProducer {

    private final KafkaTemplate<String, EntityChangeMessage> kafkaTemplate;

    @Value("${app.kafka.topics.entity-changes:entity-changes}")
    private String entityChangesTopic;

    /**
     * Publishes a change asynchronously. Failures are logged on completion and
     * never reach the caller's transaction.
     */
    public CompletableFuture<SendResult<String, EntityChangeMessage>> send(EntityChangeMessage message) {
        String key = message.messageKey();
        log.debug("📤 SENDING - {} {} - topic: {}, key: {}",
                message.getOperation(), message.getTable(), entityChangesTopic, key);

        return kafkaTemplate.send(entityChangesTopic, key, message)
                .whenComplete((result, ex) -> {
                    if (ex == null) {
                        log.debug("✅ SENT - change - partition: {}, offset: {}, key: {}",
                                result.getRecordMetadata().partition(),
                                result.getRecordMetadata().offset(),
                                key);
                    } else {
                        log.error("❌ FAILED - change - topic: {}, key: {}, error: {}",
                                entityChangesTopic, key, ex.getMessage());
                    }
                });
    }
}
