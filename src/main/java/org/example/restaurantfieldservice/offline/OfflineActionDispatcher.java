package org.example.restaurantfieldservice.offline;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.restaurantfieldservice.entity.Ticket;
import org.example.restaurantfieldservice.entity.TicketHistory;
import org.example.restaurantfieldservice.enums.ChangeOperation;
import org.example.restaurantfieldservice.enums.OfflineActionType;
import org.example.restaurantfieldservice.event.EntityChangeEvent;
import org.example.restaurantfieldservice.event.TicketUpdatedEvent;
import org.example.restaurantfieldservice.exception.ResourceNotFoundException;
import org.example.restaurantfieldservice.mapper.TicketMapper;
import org.example.restaurantfieldservice.repository.TicketHistoryRepository;
import org.example.restaurantfieldservice.repository.TicketRepository;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes one queued action to the database. Replay is blind: the patch is
 * applied over whatever the row holds now, so the last write wins.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OfflineActionDispatcher {

    public static final String TICKETS_TABLE = "tickets";
    public static final String HISTORY_TABLE = "ticket_history";

    private final TicketRepository ticketRepository;
    private final TicketHistoryRepository historyRepository;
    private final TicketMapper ticketMapper;
    private final ObjectMapper objectMapper;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * @throws IllegalArgumentException for an action this queue does not replay
     */
    @Transactional
    public void dispatch(OfflineAction action) {
        if (TICKETS_TABLE.equals(action.getTable()) && action.getType() == OfflineActionType.UPDATE) {
            applyTicketPatch(action);
        } else if (HISTORY_TABLE.equals(action.getTable()) && action.getType() == OfflineActionType.CREATE) {
            insertHistory(action);
        } else {
            throw new IllegalArgumentException(String.format(
                    "Unsupported offline action %s on %s", action.getType(), action.getTable()));
        }
    }

    private void applyTicketPatch(OfflineAction action) {
        Ticket ticket = ticketRepository.findById(action.getRowId())
                .orElseThrow(() -> new ResourceNotFoundException("Ticket", action.getRowId()));
        TicketPatch patch = objectMapper.convertValue(action.getData(), TicketPatch.class);

        if (patch.getStatus() != null) {
            ticket.setStatus(patch.getStatus());
        }
        if (patch.getAssignedTo() != null) {
            ticket.setAssignedTo(patch.getAssignedTo());
        }
        if (patch.getAssignedAt() != null) {
            ticket.setAssignedAt(patch.getAssignedAt());
        }
        if (patch.getFirstResponseAt() != null) {
            ticket.setFirstResponseAt(patch.getFirstResponseAt());
        }
        if (patch.getResolvedAt() != null) {
            ticket.setResolvedAt(patch.getResolvedAt());
        }
        if (patch.getClosedAt() != null) {
            ticket.setClosedAt(patch.getClosedAt());
        }
        if (patch.getResolution() != null) {
            ticket.setResolution(patch.getResolution());
        }
        if (patch.getScheduleNote() != null) {
            ticket.setScheduleNote(patch.getScheduleNote());
        }

        Ticket saved = ticketRepository.save(ticket);
        eventPublisher.publishEvent(new TicketUpdatedEvent(this, ticketMapper.toDTO(saved)));
        eventPublisher.publishEvent(new EntityChangeEvent(this, TICKETS_TABLE, saved.getId(), ChangeOperation.UPDATE));
        log.info("🔁 Replayed ticket patch {} on ticket {}", action.getId(), saved.getId());
    }

    private void insertHistory(OfflineAction action) {
        if (!ticketRepository.existsById(action.getRowId())) {
            throw new ResourceNotFoundException("Ticket", action.getRowId());
        }
        HistoryEntryPatch entry = objectMapper.convertValue(action.getData(), HistoryEntryPatch.class);
        TicketHistory saved = historyRepository.save(TicketHistory.builder()
                .ticketId(action.getRowId())
                .status(entry.getStatus())
                .notes(entry.getNotes())
                .userId(entry.getUserId())
                .timestamp(entry.getTimestamp() != null ? entry.getTimestamp() : action.getTimestamp())
                .build());
        eventPublisher.publishEvent(new EntityChangeEvent(this, HISTORY_TABLE, saved.getId(), ChangeOperation.INSERT));
        log.info("🔁 Replayed history entry {} on ticket {}", action.getId(), action.getRowId());
    }
}
