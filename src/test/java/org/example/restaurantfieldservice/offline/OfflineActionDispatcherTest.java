package org.example.restaurantfieldservice.offline;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.example.restaurantfieldservice.entity.Ticket;
import org.example.restaurantfieldservice.entity.TicketHistory;
import org.example.restaurantfieldservice.enums.OfflineActionType;
import org.example.restaurantfieldservice.enums.TicketPriority;
import org.example.restaurantfieldservice.enums.TicketStatus;
import org.example.restaurantfieldservice.event.TicketUpdatedEvent;
import org.example.restaurantfieldservice.exception.ResourceNotFoundException;
import org.example.restaurantfieldservice.lifecycle.SlaPolicy;
import org.example.restaurantfieldservice.mapper.TicketMapper;
import org.example.restaurantfieldservice.repository.TicketHistoryRepository;
import org.example.restaurantfieldservice.repository.TicketRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OfflineActionDispatcherTest {

    private static final LocalDateTime QUEUED_AT = LocalDateTime.of(2026, 3, 2, 9, 30);

    @Mock private TicketRepository ticketRepository;
    @Mock private TicketHistoryRepository historyRepository;
    @Mock private ApplicationEventPublisher eventPublisher;

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
    private OfflineActionDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        SlaPolicy slaPolicy = new SlaPolicy(Clock.fixed(Instant.parse("2026-03-02T10:00:00Z"), ZoneOffset.UTC));
        dispatcher = new OfflineActionDispatcher(ticketRepository, historyRepository, new TicketMapper(slaPolicy),
                objectMapper, eventPublisher);
    }

    private Map<String, Object> toMap(Object payload) {
        return objectMapper.convertValue(payload, new TypeReference<Map<String, Object>>() {
        });
    }

    @Test
    void ticketPatchOverwritesOnlyTheFieldsItCarries() {
        Ticket ticket = Ticket.builder()
                .id(10L).ticketNumber("TKT-1").title("Fryer").priority(TicketPriority.HIGH)
                .status(TicketStatus.ASSIGNED).assignedTo(7L).build();
        when(ticketRepository.findById(10L)).thenReturn(Optional.of(ticket));
        when(ticketRepository.save(ticket)).thenReturn(ticket);

        dispatcher.dispatch(OfflineAction.builder()
                .id("a1")
                .type(OfflineActionType.UPDATE)
                .table(OfflineActionDispatcher.TICKETS_TABLE)
                .rowId(10L)
                .data(toMap(TicketPatch.builder().status(TicketStatus.IN_PROGRESS).firstResponseAt(QUEUED_AT).build()))
                .timestamp(QUEUED_AT)
                .build());

        assertThat(ticket.getStatus()).isEqualTo(TicketStatus.IN_PROGRESS);
        assertThat(ticket.getFirstResponseAt()).isEqualTo(QUEUED_AT);
        assertThat(ticket.getAssignedTo()).isEqualTo(7L);
        verify(eventPublisher).publishEvent(any(TicketUpdatedEvent.class));
    }

    @Test
    void historyEntryKeepsTheTimeItWasQueued() {
        when(ticketRepository.existsById(10L)).thenReturn(true);
        when(historyRepository.save(any(TicketHistory.class))).thenAnswer(inv -> inv.getArgument(0));

        dispatcher.dispatch(OfflineAction.builder()
                .id("a2")
                .type(OfflineActionType.CREATE)
                .table(OfflineActionDispatcher.HISTORY_TABLE)
                .rowId(10L)
                .data(toMap(HistoryEntryPatch.builder().status(TicketStatus.IN_PROGRESS)
                        .notes("Intervention started").userId(7L).build()))
                .timestamp(QUEUED_AT)
                .build());

        ArgumentCaptor<TicketHistory> saved = ArgumentCaptor.forClass(TicketHistory.class);
        verify(historyRepository).save(saved.capture());
        assertThat(saved.getValue().getTicketId()).isEqualTo(10L);
        assertThat(saved.getValue().getStatus()).isEqualTo(TicketStatus.IN_PROGRESS);
        assertThat(saved.getValue().getTimestamp()).isEqualTo(QUEUED_AT);
    }

    @Test
    void historyForMissingTicketIsRejected() {
        when(ticketRepository.existsById(99L)).thenReturn(false);

        assertThatThrownBy(() -> dispatcher.dispatch(OfflineAction.builder()
                .type(OfflineActionType.CREATE)
                .table(OfflineActionDispatcher.HISTORY_TABLE)
                .rowId(99L)
                .build()))
                .isInstanceOf(ResourceNotFoundException.class);
        verify(historyRepository, never()).save(any());
    }

    @Test
    void deletesAreNotReplayed() {
        assertThatThrownBy(() -> dispatcher.dispatch(OfflineAction.builder()
                .type(OfflineActionType.DELETE)
                .table(OfflineActionDispatcher.TICKETS_TABLE)
                .rowId(10L)
                .build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unsupported offline action DELETE on tickets");
    }
}
