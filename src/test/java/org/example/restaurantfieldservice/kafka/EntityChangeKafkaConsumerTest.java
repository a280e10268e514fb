package org.example.restaurantfieldservice.kafka;

import org.example.restaurantfieldservice.dto.TicketDTO;
import org.example.restaurantfieldservice.enums.ChangeOperation;
import org.example.restaurantfieldservice.exception.ResourceNotFoundException;
import org.example.restaurantfieldservice.kafka.consumer.EntityChangeKafkaConsumer;
import org.example.restaurantfieldservice.kafka.dto.EntityChangeMessage;
import org.example.restaurantfieldservice.service.TicketCacheService;
import org.example.restaurantfieldservice.service.TicketService;
import org.example.restaurantfieldservice.stream.ChangeSubscriptionRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.kafka.support.Acknowledgment;

import java.time.LocalDateTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EntityChangeKafkaConsumerTest {

    @Mock private TicketService ticketService;
    @Mock private TicketCacheService cacheService;
    @Mock private ChangeSubscriptionRegistry subscriptionRegistry;
    @Mock private Acknowledgment acknowledgment;

    private EntityChangeKafkaConsumer consumer;

    @BeforeEach
    void setUp() {
        consumer = new EntityChangeKafkaConsumer(ticketService, cacheService, subscriptionRegistry);
    }

    private static EntityChangeMessage change(String table, Long rowId, ChangeOperation operation) {
        return EntityChangeMessage.builder()
                .eventId("evt-1")
                .table(table)
                .rowId(rowId)
                .operation(operation)
                .occurredAt(LocalDateTime.of(2026, 3, 2, 10, 0))
                .build();
    }

    private void consume(EntityChangeMessage message) {
        consumer.consumeEntityChange(message, message.messageKey(), 0, 42L, acknowledgment);
    }

    @Test
    void ticketUpdateRefreshesOnlyThatRow() {
        EntityChangeMessage message = change("tickets", 10L, ChangeOperation.UPDATE);

        consume(message);

        verify(ticketService).refreshCachedView(10L);
        verify(subscriptionRegistry).broadcast(message);
        verify(acknowledgment).acknowledge();
    }

    @Test
    void ticketDeleteEvictsBothKeys() {
        when(cacheService.getTicketById(10L)).thenReturn(Optional.of(TicketDTO.builder()
                .id(10L).ticketNumber("TKT-1").build()));

        consume(change("tickets", 10L, ChangeOperation.DELETE));

        verify(cacheService).evictTicket(10L, "TKT-1");
        verify(ticketService, never()).refreshCachedView(anyLong());
        verify(acknowledgment).acknowledge();
    }

    @Test
    void vanishedTicketIsStillBroadcast() {
        EntityChangeMessage message = change("tickets", 10L, ChangeOperation.UPDATE);
        when(ticketService.refreshCachedView(10L)).thenThrow(new ResourceNotFoundException("Ticket", 10L));

        consume(message);

        verify(subscriptionRegistry).broadcast(message);
        verify(acknowledgment).acknowledge();
    }

    @Test
    void otherTablesOnlyFanOut() {
        EntityChangeMessage message = change("ticket_history", 5L, ChangeOperation.INSERT);

        consume(message);

        verify(ticketService, never()).refreshCachedView(anyLong());
        verify(subscriptionRegistry).broadcast(message);
    }

    @Test
    void malformedChangeIsAcknowledgedAndSkipped() {
        consume(change(null, 10L, null));

        verify(subscriptionRegistry, never()).broadcast(any());
        verify(acknowledgment).acknowledge();
    }

    @Test
    void failureIsLeftForTheErrorHandler() {
        when(ticketService.refreshCachedView(10L)).thenThrow(new RedisConnectionFailureException("down"));

        assertThatThrownBy(() -> consume(change("tickets", 10L, ChangeOperation.UPDATE)))
                .isInstanceOf(RedisConnectionFailureException.class);
        verify(acknowledgment, never()).acknowledge();
    }
}
