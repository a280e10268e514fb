package org.example.restaurantfieldservice.command;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.restaurantfieldservice.dto.TicketDTO;
import org.example.restaurantfieldservice.enums.TicketStatus;
import org.example.restaurantfieldservice.lifecycle.TicketAuthorizationPolicy;
import org.example.restaurantfieldservice.lifecycle.TicketLifecycle;
import org.example.restaurantfieldservice.offline.ConnectivityMonitor;
import org.example.restaurantfieldservice.offline.OfflineAction;
import org.example.restaurantfieldservice.offline.OfflineActionQueue;
import org.example.restaurantfieldservice.service.TicketCacheService;
import org.example.restaurantfieldservice.service.TicketService;
import org.example.restaurantfieldservice.session.SessionContext;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs ticket mutations optimistically against the Redis view cache.
 *
 * <ol>
 *   <li>Project the change onto the cached view and cache the projection</li>
 *   <li>Run the database mutation</li>
 *   <li>On failure, replace the cached view with a fresh fetch and rethrow</li>
 *   <li>If the database is unreachable and the command is queueable, queue it and
 *       return the projection marked {@code pendingSync}</li>
 * </ol>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TicketCommandExecutor {

    private final TicketService ticketService;
    private final TicketCacheService cacheService;
    private final TicketLifecycle lifecycle;
    private final TicketAuthorizationPolicy authorizationPolicy;
    private final OfflineActionQueue offlineQueue;
    private final ConnectivityMonitor connectivityMonitor;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    // ==================== COMMANDS ====================

    public TicketDTO assign(Long ticketId, Long assigneeId, String notes, SessionContext session) {
        return execute(new AssignTicketCommand(context(), session, ticketId, assigneeId, notes));
    }

    public TicketDTO transition(Long ticketId, TicketStatus target, String notes, String resolution,
                                SessionContext session) {
        return execute(new TransitionTicketCommand(context(), session, ticketId, target, notes, resolution));
    }

    public TicketDTO schedule(Long ticketId, String when, SessionContext session) {
        return execute(new ScheduleTicketCommand(context(), session, ticketId, when));
    }

    // ==================== EXECUTION ====================

    public TicketDTO execute(OptimisticTicketCommand command) {
        Long ticketId = command.ticketId();
        TicketDTO previous = cacheService.getTicketById(ticketId).orElse(null);
        TicketDTO optimistic = previous != null ? command.applyLocally(copyOf(previous)) : null;
        if (optimistic != null) {
            cacheService.cacheTicket(optimistic);
        }

        try {
            TicketDTO committed = command.executeRemote();
            connectivityMonitor.markOnline();
            cacheService.cacheTicket(committed);
            return committed;
        } catch (RuntimeException e) {
            if (ConnectivityMonitor.isConnectivityFailure(e)) {
                connectivityMonitor.markOffline(e);
                List<OfflineAction> actions = optimistic != null ? command.toOfflineActions(optimistic) : List.of();
                if (!actions.isEmpty()) {
                    return queueOffline(command, optimistic, actions, e);
                }
                log.warn("📴 Cannot {} while offline: no cached view to apply it to", command.description());
                // the cached view may carry pendingSync from earlier queued work
                if (optimistic != null) {
                    cacheService.cacheTicket(previous);
                }
                throw e;
            }

            log.warn("↩️ Rolling back optimistic view: {} failed: {}", command.description(), e.getMessage());
            rollback(ticketId, optimistic);
            throw e;
        }
    }

    // ==================== HELPERS ====================

    private TicketDTO queueOffline(OptimisticTicketCommand command, TicketDTO optimistic,
                                   List<OfflineAction> actions, RuntimeException cause) {
        try {
            actions.forEach(offlineQueue::enqueue);
        } catch (RuntimeException queueError) {
            cause.addSuppressed(queueError);
            cacheService.evictTicket(command.ticketId(), optimistic.getTicketNumber());
            throw cause;
        }
        optimistic.setPendingSync(true);
        cacheService.cacheTicket(optimistic);
        log.info("📥 {} queued for replay ({} actions)", command.description(), actions.size());
        return optimistic;
    }

    private void rollback(Long ticketId, TicketDTO optimistic) {
        cacheService.evictTicket(ticketId, optimistic != null ? optimistic.getTicketNumber() : null);
        try {
            ticketService.refreshCachedView(ticketId);
        } catch (RuntimeException refreshError) {
            log.warn("⚠️ Could not refetch ticket {} after rollback: {}", ticketId, refreshError.getMessage());
        }
    }

    private TicketDTO copyOf(TicketDTO current) {
        return current.toBuilder()
                .photos(current.getPhotos() != null ? new ArrayList<>(current.getPhotos()) : new ArrayList<>())
                .build();
    }

    private TicketCommandContext context() {
        return new TicketCommandContext(ticketService, lifecycle, authorizationPolicy, objectMapper,
                LocalDateTime.now(clock));
    }
}
