package org.example.restaurantfieldservice.command;

import org.example.restaurantfieldservice.dto.TicketDTO;
import org.example.restaurantfieldservice.enums.TicketStatus;
import org.example.restaurantfieldservice.offline.OfflineAction;
import org.example.restaurantfieldservice.offline.TicketPatch;
import org.example.restaurantfieldservice.session.SessionContext;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * Moves a ticket one lifecycle step forward.
 */
public class TransitionTicketCommand extends AbstractTicketCommand {

    private final TicketStatus target;
    private final String notes;
    private final String resolution;

    TransitionTicketCommand(TicketCommandContext context, SessionContext session, Long ticketId,
                            TicketStatus target, String notes, String resolution) {
        super(context, session, ticketId);
        this.target = target;
        this.notes = notes;
        this.resolution = resolution;
    }

    @Override
    public String description() {
        return "transition ticket " + ticketId + " to " + (target != null ? target.getValue() : null);
    }

    @Override
    public TicketDTO applyLocally(TicketDTO current) {
        if (target == null || !locallyAllowed(current, target, current.getAssignedTo())) {
            return null;
        }
        if (current.getAssignedTo() == null) {
            return null;
        }
        if (target == TicketStatus.RESOLVED && !StringUtils.hasText(resolution)) {
            return null;
        }

        TicketDTO next = current.toBuilder().build();
        next.setStatus(target);
        switch (target) {
            case ASSIGNED -> next.setAssignedAt(requestedAt);
            case IN_PROGRESS -> {
                if (next.getFirstResponseAt() == null) {
                    next.setFirstResponseAt(requestedAt);
                }
            }
            case SCHEDULED -> next.setScheduleNote(notes);
            case RESOLVED -> {
                next.setResolvedAt(requestedAt);
                next.setResolution(resolution.trim());
                next.setOverdue(false);
            }
            case CLOSED -> {
                next.setClosedAt(requestedAt);
                next.setOverdue(false);
            }
            default -> {
            }
        }
        next.setUpdatedAt(requestedAt);
        return next;
    }

    @Override
    public TicketDTO executeRemote() {
        return ticketService.transitionTicket(ticketId, target, notes, resolution, session);
    }

    @Override
    public List<OfflineAction> toOfflineActions(TicketDTO optimistic) {
        TicketPatch patch = TicketPatch.builder()
                .status(optimistic.getStatus())
                .assignedAt(target == TicketStatus.ASSIGNED ? optimistic.getAssignedAt() : null)
                .firstResponseAt(target == TicketStatus.IN_PROGRESS ? optimistic.getFirstResponseAt() : null)
                .resolvedAt(target == TicketStatus.RESOLVED ? optimistic.getResolvedAt() : null)
                .closedAt(target == TicketStatus.CLOSED ? optimistic.getClosedAt() : null)
                .resolution(target == TicketStatus.RESOLVED ? optimistic.getResolution() : null)
                .scheduleNote(target == TicketStatus.SCHEDULED ? optimistic.getScheduleNote() : null)
                .build();
        String note = StringUtils.hasText(notes) ? notes.trim() : "Status changed to " + target.getValue();
        return statusChangeActions(patch, target, note);
    }
}
