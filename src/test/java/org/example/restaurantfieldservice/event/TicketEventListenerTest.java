package org.example.restaurantfieldservice.event;

import org.example.restaurantfieldservice.dto.TicketDTO;
import org.example.restaurantfieldservice.entity.EquipmentItem;
import org.example.restaurantfieldservice.enums.ChangeOperation;
import org.example.restaurantfieldservice.enums.TicketPriority;
import org.example.restaurantfieldservice.enums.TicketSource;
import org.example.restaurantfieldservice.enums.TicketStatus;
import org.example.restaurantfieldservice.kafka.dto.EntityChangeMessage;
import org.example.restaurantfieldservice.kafka.producer.EntityChangeKafkaProducer;
import org.example.restaurantfieldservice.lifecycle.SlaPolicy;
import org.example.restaurantfieldservice.repository.EquipmentItemRepository;
import org.example.restaurantfieldservice.service.NotificationService;
import org.example.restaurantfieldservice.service.TicketCacheService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TicketEventListenerTest {

    @Mock private TicketCacheService cacheService;
    @Mock private NotificationService notificationService;
    @Mock private EntityChangeKafkaProducer changeProducer;
    @Mock private EquipmentItemRepository equipmentRepository;

    private TicketEventListener listener;

    @BeforeEach
    void setUp() {
        listener = new TicketEventListener(cacheService, notificationService, changeProducer, equipmentRepository,
                new SlaPolicy(Clock.fixed(Instant.parse("2026-03-02T10:00:00Z"), ZoneOffset.UTC)));
    }

    private static TicketDTO ticket(TicketStatus status, Long assignee, TicketSource source) {
        return TicketDTO.builder()
                .id(10L).ticketNumber("TKT-1").title("Fryer").status(status)
                .priority(TicketPriority.HIGH).source(source).assignedTo(assignee).createdBy(3L)
                .build();
    }

    @Test
    void helpdeskTicketsAreOfferedToTechnicians() {
        TicketDTO created = ticket(TicketStatus.NEW, null, TicketSource.HELPDESK);

        listener.handleTicketCreated(new TicketCreatedEvent(this, created));

        verify(cacheService).cacheTicket(created);
        verify(notificationService).notifyFieldTicketAvailable(created);
        verify(notificationService, never()).notifyTicketCreated(any());
    }

    @Test
    void standardTicketsGoToManagers() {
        TicketDTO created = ticket(TicketStatus.NEW, null, TicketSource.STANDARD);

        listener.handleTicketCreated(new TicketCreatedEvent(this, created));

        verify(notificationService).notifyTicketCreated(created);
    }

    @Test
    void cacheOutageDoesNotStopNotifications() {
        TicketDTO created = ticket(TicketStatus.NEW, null, TicketSource.STANDARD);
        doThrow(new RedisConnectionFailureException("down")).when(cacheService).cacheTicket(created);

        listener.handleTicketCreated(new TicketCreatedEvent(this, created));

        verify(notificationService).notifyTicketCreated(created);
    }

    @Test
    void newAssigneeIsNotified() {
        TicketDTO assigned = ticket(TicketStatus.ASSIGNED, 7L, TicketSource.STANDARD);

        listener.handleStatusChanged(new TicketStatusChangedEvent(this, assigned, TicketStatus.NEW, null, 7L));

        verify(cacheService).evictTicket(10L, "TKT-1");
        verify(cacheService).cacheTicket(assigned);
        verify(notificationService).notifyAssigned(assigned);
        verify(notificationService, never()).notifyStatusChanged(any());
    }

    @Test
    void resolutionNotifiesTheCreator() {
        TicketDTO resolved = ticket(TicketStatus.RESOLVED, 7L, TicketSource.STANDARD);

        listener.handleStatusChanged(new TicketStatusChangedEvent(this, resolved, TicketStatus.IN_PROGRESS, 7L, 7L));

        verify(notificationService).notifyStatusChanged(resolved);
        verify(notificationService).notifyResolved(resolved);
    }

    @Test
    void rowChangesArePublishedWithTheirKey() {
        listener.handleEntityChange(new EntityChangeEvent(this, "tickets", 10L, ChangeOperation.UPDATE));

        ArgumentCaptor<EntityChangeMessage> sent = ArgumentCaptor.forClass(EntityChangeMessage.class);
        verify(changeProducer).send(sent.capture());
        assertThat(sent.getValue().messageKey()).isEqualTo("tickets:10");
        assertThat(sent.getValue().getOperation()).isEqualTo(ChangeOperation.UPDATE);
        assertThat(sent.getValue().getEventId()).isNotBlank();
    }

    @Test
    void onlyItemsAtOrBelowMinimumRaiseLowStock() {
        EquipmentItem low = EquipmentItem.builder().id(4L).name("Element").stockLevel(2).minStockLevel(2).build();
        EquipmentItem fine = EquipmentItem.builder().id(5L).name("Gasket").stockLevel(9).minStockLevel(2).build();
        when(equipmentRepository.findAllById(List.of(4L, 5L))).thenReturn(List.of(low, fine));

        listener.handleInventoryConsumed(new InventoryConsumedEvent(this, 10L, 55L, List.of(4L, 5L)));

        verify(notificationService).notifyLowStock(low);
        verify(notificationService, never()).notifyLowStock(fine);
    }
}
