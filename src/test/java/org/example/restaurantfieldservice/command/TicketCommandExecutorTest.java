package org.example.restaurantfieldservice.command;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.example.restaurantfieldservice.dto.TicketDTO;
import org.example.restaurantfieldservice.enums.OfflineActionType;
import org.example.restaurantfieldservice.enums.TicketPriority;
import org.example.restaurantfieldservice.enums.TicketStatus;
import org.example.restaurantfieldservice.enums.UserRole;
import org.example.restaurantfieldservice.exception.InvalidTicketOperationException;
import org.example.restaurantfieldservice.lifecycle.TicketAuthorizationPolicy;
import org.example.restaurantfieldservice.lifecycle.TicketLifecycle;
import org.example.restaurantfieldservice.offline.ConnectivityMonitor;
import org.example.restaurantfieldservice.offline.OfflineAction;
import org.example.restaurantfieldservice.offline.OfflineActionDispatcher;
import org.example.restaurantfieldservice.offline.OfflineActionQueue;
import org.example.restaurantfieldservice.service.TicketCacheService;
import org.example.restaurantfieldservice.service.TicketService;
import org.example.restaurantfieldservice.session.SessionContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.CannotCreateTransactionException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("TicketCommandExecutor")
class TicketCommandExecutorTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    @Mock private TicketService ticketService;
    @Mock private TicketCacheService cacheService;
    @Mock private OfflineActionQueue offlineQueue;
    @Mock private ConnectivityMonitor connectivityMonitor;

    private TicketCommandExecutor executor;

    private final SessionContext technician = SessionContext.builder()
            .userId(7L).name("Tina").email("tech@test").role(UserRole.TECHNICIAN).build();

    @BeforeEach
    void setUp() {
        TicketLifecycle lifecycle = new TicketLifecycle();
        executor = new TicketCommandExecutor(ticketService, cacheService, lifecycle,
                new TicketAuthorizationPolicy(lifecycle), offlineQueue, connectivityMonitor,
                new ObjectMapper().registerModule(new JavaTimeModule()), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private TicketDTO cached(TicketStatus status, Long assignee) {
        return TicketDTO.builder()
                .id(10L)
                .ticketNumber("TKT-20260302-ABC123")
                .title("Fryer not heating")
                .status(status)
                .priority(TicketPriority.HIGH)
                .assignedTo(assignee)
                .build();
    }

    @Nested
    @DisplayName("online")
    class Online {

        @Test
        @DisplayName("caches the projection first, then the committed view")
        void projectionThenCommitted() {
            TicketDTO committed = cached(TicketStatus.ASSIGNED, 7L);
            when(cacheService.getTicketById(10L)).thenReturn(Optional.of(cached(TicketStatus.NEW, null)));
            when(ticketService.assignTicket(10L, 7L, null, technician)).thenReturn(committed);

            TicketDTO result = executor.assign(10L, 7L, null, technician);

            assertThat(result).isSameAs(committed);
            ArgumentCaptor<TicketDTO> cachedViews = ArgumentCaptor.forClass(TicketDTO.class);
            verify(cacheService, times(2)).cacheTicket(cachedViews.capture());
            TicketDTO projection = cachedViews.getAllValues().get(0);
            assertThat(projection.getStatus()).isEqualTo(TicketStatus.ASSIGNED);
            assertThat(projection.getAssignedTo()).isEqualTo(7L);
            assertThat(projection.getAssignedAt()).isEqualTo(LocalDateTime.ofInstant(NOW, ZoneOffset.UTC));
            assertThat(cachedViews.getAllValues().get(1)).isSameAs(committed);
            verify(connectivityMonitor).markOnline();
        }

        @Test
        @DisplayName("a rejected change replaces the projection with a fresh fetch")
        void rejectedChangeRollsBack() {
            when(cacheService.getTicketById(10L)).thenReturn(Optional.of(cached(TicketStatus.ASSIGNED, 7L)));
            InvalidTicketOperationException rejected = new InvalidTicketOperationException("transition", "Rejected");
            when(ticketService.transitionTicket(10L, TicketStatus.IN_PROGRESS, "Intervention started", null, technician))
                    .thenThrow(rejected);

            assertThatThrownBy(() -> executor.transition(10L, TicketStatus.IN_PROGRESS, "Intervention started", null,
                    technician))
                    .isSameAs(rejected);

            verify(cacheService).evictTicket(10L, "TKT-20260302-ABC123");
            verify(ticketService).refreshCachedView(10L);
            verify(offlineQueue, never()).enqueue(any());
        }

        @Test
        @DisplayName("a change that cannot be shown locally still goes to the database")
        void noProjectionForInvalidChange() {
            TicketDTO committed = cached(TicketStatus.NEW, null);
            when(cacheService.getTicketById(10L)).thenReturn(Optional.of(committed));
            when(ticketService.transitionTicket(10L, TicketStatus.IN_PROGRESS, null, null, technician))
                    .thenReturn(committed);

            executor.transition(10L, TicketStatus.IN_PROGRESS, null, null, technician);

            verify(cacheService, times(1)).cacheTicket(committed);
        }
    }

    @Nested
    @DisplayName("database unreachable")
    class Offline {

        @Test
        @DisplayName("queues a ticket patch and a history row and returns the pending projection")
        void queuesStatusChange() {
            when(cacheService.getTicketById(10L)).thenReturn(Optional.of(cached(TicketStatus.ASSIGNED, 7L)));
            CannotCreateTransactionException down = new CannotCreateTransactionException("Connection refused");
            when(ticketService.transitionTicket(10L, TicketStatus.IN_PROGRESS, "Intervention started", null, technician))
                    .thenThrow(down);

            TicketDTO result = executor.transition(10L, TicketStatus.IN_PROGRESS, "Intervention started", null,
                    technician);

            assertThat(result.isPendingSync()).isTrue();
            assertThat(result.getStatus()).isEqualTo(TicketStatus.IN_PROGRESS);
            verify(connectivityMonitor).markOffline(down);

            ArgumentCaptor<OfflineAction> queued = ArgumentCaptor.forClass(OfflineAction.class);
            verify(offlineQueue, times(2)).enqueue(queued.capture());
            List<OfflineAction> actions = queued.getAllValues();
            assertThat(actions.get(0).getTable()).isEqualTo(OfflineActionDispatcher.TICKETS_TABLE);
            assertThat(actions.get(0).getType()).isEqualTo(OfflineActionType.UPDATE);
            assertThat(actions.get(1).getTable()).isEqualTo(OfflineActionDispatcher.HISTORY_TABLE);
            assertThat(actions.get(1).getType()).isEqualTo(OfflineActionType.CREATE);
            assertThat(actions.get(1).getData()).containsEntry("notes", "Intervention started");
            assertThat(actions).allSatisfy(a -> assertThat(a.getRowId()).isEqualTo(10L));
        }

        @Test
        @DisplayName("without a cached view the failure is rethrown")
        void nothingToQueueWithoutCachedView() {
            when(cacheService.getTicketById(10L)).thenReturn(Optional.empty());
            CannotCreateTransactionException down = new CannotCreateTransactionException("Connection refused");
            when(ticketService.assignTicket(10L, 7L, null, technician)).thenThrow(down);

            assertThatThrownBy(() -> executor.assign(10L, 7L, null, technician)).isSameAs(down);

            verify(offlineQueue, never()).enqueue(any());
        }

        @Test
        @DisplayName("a change that cannot be shown locally keeps the pending view cached")
        void keepsPendingViewWhenNothingToProject() {
            TicketDTO pending = cached(TicketStatus.IN_PROGRESS, 7L);
            pending.setPendingSync(true);
            when(cacheService.getTicketById(10L)).thenReturn(Optional.of(pending));
            CannotCreateTransactionException down = new CannotCreateTransactionException("Connection refused");
            when(ticketService.transitionTicket(10L, TicketStatus.ASSIGNED, null, null, technician)).thenThrow(down);

            assertThatThrownBy(() -> executor.transition(10L, TicketStatus.ASSIGNED, null, null, technician))
                    .isSameAs(down);

            verify(cacheService, never()).evictTicket(any(), any());
            verify(cacheService, never()).cacheTicket(any());
            verify(offlineQueue, never()).enqueue(any());
        }

        @Test
        @DisplayName("a queue failure surfaces the original error")
        void queueFailureRethrowsCause() {
            when(cacheService.getTicketById(10L)).thenReturn(Optional.of(cached(TicketStatus.NEW, null)));
            CannotCreateTransactionException down = new CannotCreateTransactionException("Connection refused");
            when(ticketService.assignTicket(10L, 7L, null, technician)).thenThrow(down);
            doThrow(new IllegalStateException("Offline queue unavailable")).when(offlineQueue).enqueue(any());

            assertThatThrownBy(() -> executor.assign(10L, 7L, null, technician))
                    .isSameAs(down)
                    .satisfies(e -> assertThat(e.getSuppressed()).hasSize(1));

            verify(cacheService).evictTicket(10L, "TKT-20260302-ABC123");
        }
    }
}
