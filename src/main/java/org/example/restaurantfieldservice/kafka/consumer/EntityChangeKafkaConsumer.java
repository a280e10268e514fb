package org.example.restaurantfieldservice.kafka.consumer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.example.restaurantfieldservice.enums.ChangeOperation;
import org.example.restaurantfieldservice.exception.ResourceNotFoundException;
import org.example.restaurantfieldservice.kafka.dto.EntityChangeMessage;
import org.example.restaurantfieldservice.service.TicketCacheService;
import org.example.restaurantfieldservice.service.TicketService;
import org.example.restaurantfieldservice.stream.ChangeSubscriptionRegistry;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Service;

/**
 * Applies row changes to the ticket view cache one row at a time, then fans
 * them out to live subscribers.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EntityChangeKafkaConsumer {

    static final String TICKETS_TABLE = "tickets";

    private final TicketService ticketService;
    private final TicketCacheService cacheService;
    private final ChangeSubscriptionRegistry subscriptionRegistry;

    @KafkaListener(
            topics = "${app.kafka.topics.entity-changes:entity-changes}",
            groupId = "${spring.kafka.consumer.group-id:field-service-group}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consumeEntityChange(
            @Payload EntityChangeMessage message,
            @Header(KafkaHeaders.RECEIVED_KEY) String key,
            @Header(KafkaHeaders.RECEIVED_PARTITION) int partition,
            @Header(KafkaHeaders.OFFSET) long offset,
            Acknowledgment acknowledgment) {

        log.debug("📥 RECEIVED - {} - partition: {}, offset: {}, key: {}",
                message.getOperation(), partition, offset, key);

        if (message.getTable() == null || message.getOperation() == null) {
            log.warn("⚠️ MALFORMED - change without table or operation - key: {}, acknowledging anyway", key);
            acknowledgment.acknowledge();
            return;
        }

        try {
            if (TICKETS_TABLE.equals(message.getTable())) {
                applyTicketChange(message);
            }
            int delivered = subscriptionRegistry.broadcast(message);
            log.debug("✅ PROCESSED - {} {}#{} delivered to {} subscribers",
                    message.getOperation(), message.getTable(), message.getRowId(), delivered);
            acknowledgment.acknowledge();

        } catch (Exception e) {
            log.error("❌ PROCESSING ERROR - change {} {}#{}: {}",
                    message.getOperation(), message.getTable(), message.getRowId(), e.getMessage(), e);
            throw e;
        }
    }

    @KafkaListener(
            topics = "${app.kafka.topics.entity-changes:entity-changes}.DLT",
            groupId = "${spring.kafka.consumer.group-id:field-service-group}-dlt"
    )
    public void consumeEntityChangesDlt(
            ConsumerRecord<String, Object> record,
            @Header(KafkaHeaders.RECEIVED_PARTITION) int partition,
            @Header(KafkaHeaders.OFFSET) long offset,
            Acknowledgment acknowledgment) {

        log.error("☠️ DLT RECEIVED - topic: {}, partition: {}, offset: {}, key: {}, value: {}",
                record.topic(), partition, offset, record.key(), record.value());
        acknowledgment.acknowledge();
    }

    private void applyTicketChange(EntityChangeMessage message) {
        Long ticketId = message.getRowId();
        if (message.getOperation() == ChangeOperation.DELETE) {
            cacheService.getTicketById(ticketId)
                    .ifPresentOrElse(
                            cached -> cacheService.evictTicket(ticketId, cached.getTicketNumber()),
                            () -> cacheService.evictTicket(ticketId, null));
            return;
        }
        try {
            ticketService.refreshCachedView(ticketId);
        } catch (ResourceNotFoundException e) {
            log.debug("Ticket {} vanished before its cached view could be refreshed", ticketId);
        }
    }
}
