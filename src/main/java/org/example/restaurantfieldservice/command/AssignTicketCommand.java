package org.example.restaurantfieldservice.command;

import org.example.restaurantfieldservice.dto.TicketDTO;
import org.example.restaurantfieldservice.enums.TicketStatus;
import org.example.restaurantfieldservice.offline.OfflineAction;
import org.example.restaurantfieldservice.offline.TicketPatch;
import org.example.restaurantfieldservice.session.SessionContext;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * Assigns a new ticket, or hands an assigned one to another technician.
 */
public class AssignTicketCommand extends AbstractTicketCommand {

    private final Long assigneeId;
    private final String notes;

    AssignTicketCommand(TicketCommandContext context, SessionContext session, Long ticketId,
                        Long assigneeId, String notes) {
        super(context, session, ticketId);
        this.assigneeId = assigneeId;
        this.notes = notes;
    }

    @Override
    public String description() {
        return "assign ticket " + ticketId + " to " + assigneeId;
    }

    @Override
    public TicketDTO applyLocally(TicketDTO current) {
        if (assigneeId == null) {
            return null;
        }
        boolean firstAssignment = current.getStatus() == TicketStatus.NEW;
        boolean handOver = current.getStatus() == TicketStatus.ASSIGNED && !assigneeId.equals(current.getAssignedTo());
        if (!firstAssignment && !handOver) {
            return null;
        }
        if (!authorizationPolicy.canTransition(session, current.getStatus(), current.getAssignedTo(),
                TicketStatus.ASSIGNED, assigneeId)) {
            return null;
        }

        TicketDTO next = current.toBuilder().build();
        next.setStatus(TicketStatus.ASSIGNED);
        next.setAssignedTo(assigneeId);
        next.setAssignedAt(requestedAt);
        next.setUpdatedAt(requestedAt);
        return next;
    }

    @Override
    public TicketDTO executeRemote() {
        return ticketService.assignTicket(ticketId, assigneeId, notes, session);
    }

    @Override
    public List<OfflineAction> toOfflineActions(TicketDTO optimistic) {
        TicketPatch patch = TicketPatch.builder()
                .status(TicketStatus.ASSIGNED)
                .assignedTo(assigneeId)
                .assignedAt(optimistic.getAssignedAt())
                .build();
        String note;
        if (StringUtils.hasText(notes)) {
            note = notes.trim();
        } else if (assigneeId.equals(session.getUserId())) {
            note = "Ticket self-assigned by technician";
        } else {
            note = "Ticket assigned to user " + assigneeId;
        }
        return statusChangeActions(patch, TicketStatus.ASSIGNED, note);
    }
}
