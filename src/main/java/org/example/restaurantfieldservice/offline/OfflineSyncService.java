package org.example.restaurantfieldservice.offline;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.restaurantfieldservice.dto.SyncResult;
import org.example.restaurantfieldservice.dto.SyncStatusDTO;
import org.example.restaurantfieldservice.event.ConnectivityRestoredEvent;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Replays the offline queue in enqueue order.
 *
 * <p>A pass runs on the offline to online edge and every
 * {@code app.offline.sync-interval-ms}. It stops at the first action that fails:
 * a connectivity failure leaves the action untouched, any other failure counts a
 * retry, and an action that has failed {@code app.offline.max-retries} times is
 * dropped and logged.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OfflineSyncService {

    private final OfflineActionQueue queue;
    private final OfflineActionDispatcher dispatcher;
    private final ConnectivityMonitor connectivityMonitor;
    private final Clock clock;

    @Value("${app.offline.max-retries:3}")
    private int maxRetries = 3;

    private final AtomicBoolean syncing = new AtomicBoolean(false);

    private volatile SyncResult lastResult;
    private volatile LocalDateTime lastSyncTime;

    // ==================== TRIGGERS ====================

    @Scheduled(fixedDelayString = "${app.offline.sync-interval-ms:30000}",
            initialDelayString = "${app.offline.sync-interval-ms:30000}")
    public void scheduledSync() {
        if (queue.size() <= 0) {
            return;
        }
        if (connectivityMonitor.probe()) {
            syncPendingActions();
        }
    }

    @Async
    @EventListener
    public void onConnectivityRestored(ConnectivityRestoredEvent event) {
        syncPendingActions();
    }

    // ==================== REPLAY ====================

    public SyncResult syncPendingActions() {
        LocalDateTime now = LocalDateTime.now(clock);
        if (!syncing.compareAndSet(false, true)) {
            log.debug("Offline sync already running, skipping");
            List<String> errors = new ArrayList<>();
            errors.add("Sync already in progress");
            return SyncResult.builder().success(false).errors(errors).syncTime(now).build();
        }

        int synced = 0;
        int failed = 0;
        int dropped = 0;
        boolean aborted = false;
        List<String> errors = new ArrayList<>();

        try {
            while (true) {
                Optional<OfflineAction> head;
                try {
                    head = queue.peek();
                } catch (IllegalStateException e) {
                    log.error("🗑️ Dropping unreadable offline action: {}", e.getMessage());
                    queue.removeHead();
                    dropped++;
                    errors.add(e.getMessage());
                    continue;
                }
                if (head.isEmpty()) {
                    break;
                }

                OfflineAction action = head.get();
                try {
                    dispatcher.dispatch(action);
                    queue.removeHead();
                    synced++;
                } catch (Exception e) {
                    if (ConnectivityMonitor.isConnectivityFailure(e)) {
                        connectivityMonitor.markOffline(e);
                        errors.add("Database unreachable: " + e.getMessage());
                        aborted = true;
                        break;
                    }

                    failed++;
                    action.setRetryCount(action.getRetryCount() + 1);
                    action.setLastError(e.getMessage());
                    errors.add(String.format("%s %s#%d: %s",
                            action.getType(), action.getTable(), action.getRowId(), e.getMessage()));

                    if (action.getRetryCount() >= maxRetries) {
                        log.error("🗑️ Dropping offline action {} ({} {}#{}) after {} attempts: {}",
                                action.getId(), action.getType(), action.getTable(), action.getRowId(),
                                action.getRetryCount(), e.getMessage());
                        queue.removeHead();
                        dropped++;
                    } else {
                        log.warn("⚠️ Offline action {} failed (attempt {}/{}): {}",
                                action.getId(), action.getRetryCount(), maxRetries, e.getMessage());
                        queue.replaceHead(action);
                        aborted = true;
                        break;
                    }
                }
            }
        } catch (Exception e) {
            log.error("❌ Offline sync pass interrupted: {}", e.getMessage(), e);
            errors.add("Sync interrupted: " + e.getMessage());
            aborted = true;
        } finally {
            syncing.set(false);
        }

        SyncResult result = SyncResult.builder()
                .success(!aborted && failed == 0)
                .syncedActions(synced)
                .failedActions(failed)
                .droppedActions(dropped)
                .errors(errors)
                .syncTime(now)
                .build();
        lastResult = result;
        lastSyncTime = now;

        if (synced > 0 || failed > 0 || dropped > 0) {
            log.info("🔄 Offline sync - synced: {}, failed: {}, dropped: {}", synced, failed, dropped);
        }
        return result;
    }

    public SyncStatusDTO getStatus() {
        return SyncStatusDTO.builder()
                .online(connectivityMonitor.isOnline())
                .pendingActions(queue.size())
                .lastSyncTime(lastSyncTime)
                .lastResult(lastResult)
                .build();
    }
}
