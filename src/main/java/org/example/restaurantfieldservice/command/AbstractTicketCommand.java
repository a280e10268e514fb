package org.example.restaurantfieldservice.command;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.restaurantfieldservice.dto.TicketDTO;
import org.example.restaurantfieldservice.enums.OfflineActionType;
import org.example.restaurantfieldservice.enums.TicketStatus;
import org.example.restaurantfieldservice.lifecycle.TicketAuthorizationPolicy;
import org.example.restaurantfieldservice.lifecycle.TicketLifecycle;
import org.example.restaurantfieldservice.offline.HistoryEntryPatch;
import org.example.restaurantfieldservice.offline.OfflineAction;
import org.example.restaurantfieldservice.offline.OfflineActionDispatcher;
import org.example.restaurantfieldservice.offline.TicketPatch;
import org.example.restaurantfieldservice.service.TicketService;
import org.example.restaurantfieldservice.session.SessionContext;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Shared plumbing for the status-changing commands: local lifecycle and
 * permission checks on the cached view, and the pair of offline actions
 * (ticket patch plus history row) a status change queues.
 */
abstract class AbstractTicketCommand implements OptimisticTicketCommand {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    protected final TicketService ticketService;
    protected final TicketLifecycle lifecycle;
    protected final TicketAuthorizationPolicy authorizationPolicy;
    protected final ObjectMapper objectMapper;
    protected final SessionContext session;
    protected final Long ticketId;
    protected final LocalDateTime requestedAt;

    protected AbstractTicketCommand(TicketCommandContext context, SessionContext session, Long ticketId) {
        this.ticketService = context.getTicketService();
        this.lifecycle = context.getLifecycle();
        this.authorizationPolicy = context.getAuthorizationPolicy();
        this.objectMapper = context.getObjectMapper();
        this.requestedAt = context.getNow();
        this.session = session;
        this.ticketId = ticketId;
    }

    @Override
    public Long ticketId() {
        return ticketId;
    }

    /**
     * Forward step that the caller may take, judged on the cached view.
     */
    protected boolean locallyAllowed(TicketDTO current, TicketStatus target, Long newAssignee) {
        return current.getStatus() != target
                && lifecycle.isAllowed(current.getStatus(), target)
                && authorizationPolicy.canTransition(
                        session, current.getStatus(), current.getAssignedTo(), target, newAssignee);
    }

    protected List<OfflineAction> statusChangeActions(TicketPatch patch, TicketStatus status, String notes) {
        HistoryEntryPatch entry = HistoryEntryPatch.builder()
                .status(status)
                .notes(notes)
                .userId(session.getUserId())
                .timestamp(requestedAt)
                .build();

        List<OfflineAction> actions = new ArrayList<>();
        actions.add(action(OfflineActionType.UPDATE, OfflineActionDispatcher.TICKETS_TABLE, patch));
        actions.add(action(OfflineActionType.CREATE, OfflineActionDispatcher.HISTORY_TABLE, entry));
        return actions;
    }

    private OfflineAction action(OfflineActionType type, String table, Object payload) {
        return OfflineAction.builder()
                .id(UUID.randomUUID().toString())
                .type(type)
                .table(table)
                .rowId(ticketId)
                .data(objectMapper.convertValue(payload, MAP_TYPE))
                .timestamp(requestedAt)
                .build();
    }
}
