package org.example.restaurantfieldservice.offline;

import org.example.restaurantfieldservice.dto.SyncResult;
import org.example.restaurantfieldservice.dto.SyncStatusDTO;
import org.example.restaurantfieldservice.enums.OfflineActionType;
import org.example.restaurantfieldservice.exception.ResourceNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.CannotCreateTransactionException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OfflineSyncServiceTest {

    @Mock private OfflineActionQueue queue;
    @Mock private OfflineActionDispatcher dispatcher;
    @Mock private ConnectivityMonitor connectivityMonitor;

    private OfflineSyncService syncService;

    @BeforeEach
    void setUp() {
        syncService = new OfflineSyncService(queue, dispatcher, connectivityMonitor,
                Clock.fixed(Instant.parse("2026-03-02T10:00:00Z"), ZoneOffset.UTC));
    }

    private static OfflineAction action(String id, int retries) {
        return OfflineAction.builder()
                .id(id)
                .type(OfflineActionType.UPDATE)
                .table("tickets")
                .rowId(10L)
                .retryCount(retries)
                .build();
    }

    @Nested
    @DisplayName("syncPendingActions")
    class SyncPendingActions {

        @Test
        @DisplayName("replays the queue head first and empties it")
        void replaysInOrder() {
            OfflineAction first = action("a1", 0);
            OfflineAction second = action("a2", 0);
            when(queue.peek()).thenReturn(Optional.of(first), Optional.of(second), Optional.empty());

            SyncResult result = syncService.syncPendingActions();

            InOrder order = inOrder(dispatcher);
            order.verify(dispatcher).dispatch(first);
            order.verify(dispatcher).dispatch(second);
            verify(queue, times(2)).removeHead();
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getSyncedActions()).isEqualTo(2);
            assertThat(result.getErrors()).isEmpty();
        }

        @Test
        @DisplayName("an unreachable database stops the pass without counting a retry")
        void connectivityFailureLeavesHeadUntouched() {
            OfflineAction head = action("a1", 0);
            when(queue.peek()).thenReturn(Optional.of(head));
            CannotCreateTransactionException down = new CannotCreateTransactionException("Connection refused");
            doThrow(down).when(dispatcher).dispatch(head);

            SyncResult result = syncService.syncPendingActions();

            assertThat(result.isSuccess()).isFalse();
            assertThat(head.getRetryCount()).isZero();
            verify(connectivityMonitor).markOffline(down);
            verify(queue, never()).removeHead();
            verify(queue, never()).replaceHead(any());
        }

        @Test
        @DisplayName("a rejected write counts a retry and blocks the actions behind it")
        void rejectedWriteCountsRetry() {
            OfflineAction head = action("a1", 0);
            when(queue.peek()).thenReturn(Optional.of(head));
            doThrow(new ResourceNotFoundException("Ticket", 10L)).when(dispatcher).dispatch(head);

            SyncResult result = syncService.syncPendingActions();

            ArgumentCaptor<OfflineAction> stored = ArgumentCaptor.forClass(OfflineAction.class);
            verify(queue).replaceHead(stored.capture());
            assertThat(stored.getValue().getRetryCount()).isEqualTo(1);
            assertThat(stored.getValue().getLastError()).contains("Ticket not found");
            assertThat(result.getFailedActions()).isEqualTo(1);
            assertThat(result.getDroppedActions()).isZero();
            verify(dispatcher, times(1)).dispatch(any());
        }

        @Test
        @DisplayName("an action out of retries is dropped and the pass moves on")
        void exhaustedActionIsDropped() {
            OfflineAction doomed = action("a1", 2);
            OfflineAction next = action("a2", 0);
            when(queue.peek()).thenReturn(Optional.of(doomed), Optional.of(next), Optional.empty());
            doThrow(new IllegalArgumentException("Unsupported offline action")).when(dispatcher).dispatch(doomed);

            SyncResult result = syncService.syncPendingActions();

            assertThat(result.getDroppedActions()).isEqualTo(1);
            assertThat(result.getSyncedActions()).isEqualTo(1);
            verify(dispatcher).dispatch(next);
            verify(queue, times(2)).removeHead();
        }

        @Test
        void unreadableHeadIsDropped() {
            when(queue.peek())
                    .thenThrow(new IllegalStateException("Corrupt offline action in queue"))
                    .thenReturn(Optional.empty());

            SyncResult result = syncService.syncPendingActions();

            assertThat(result.getDroppedActions()).isEqualTo(1);
            verify(queue).removeHead();
            verify(dispatcher, never()).dispatch(any());
        }
    }

    @Nested
    @DisplayName("triggers and status")
    class TriggersAndStatus {

        @Test
        @DisplayName("the timer does not probe while the queue is empty")
        void emptyQueueSkipsProbe() {
            when(queue.size()).thenReturn(0L);

            syncService.scheduledSync();

            verify(connectivityMonitor, never()).probe();
        }

        @Test
        void timerReplaysWhenDatabaseIsBack() {
            when(queue.size()).thenReturn(1L);
            when(connectivityMonitor.probe()).thenReturn(true);
            when(queue.peek()).thenReturn(Optional.empty());

            syncService.scheduledSync();

            verify(queue).peek();
        }

        @Test
        void statusReportsLastPass() {
            when(queue.peek()).thenReturn(Optional.empty());
            syncService.syncPendingActions();
            when(connectivityMonitor.isOnline()).thenReturn(true);
            when(queue.size()).thenReturn(0L);

            SyncStatusDTO status = syncService.getStatus();

            assertThat(status.isOnline()).isTrue();
            assertThat(status.getPendingActions()).isZero();
            assertThat(status.getLastResult()).isNotNull();
            assertThat(status.getLastSyncTime()).isNotNull();
        }
    }
}
