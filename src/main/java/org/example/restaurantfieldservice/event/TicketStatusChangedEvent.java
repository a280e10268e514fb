package org.example.restaurantfieldservice.event;

import lombok.Getter;
import org.example.restaurantfieldservice.dto.TicketDTO;
import org.example.restaurantfieldservice.enums.TicketStatus;

/**
 * A lifecycle transition (including assignment) was committed.
 */
@Getter
public class TicketStatusChangedEvent extends TicketEvent {

    private final TicketDTO ticketDTO;
    private final TicketStatus previousStatus;
    private final Long previousAssignee;
    private final Long actorId;

    public TicketStatusChangedEvent(Object source, TicketDTO ticketDTO, TicketStatus previousStatus,
                                    Long previousAssignee, Long actorId) {
        super(source, ticketDTO.getId(), ticketDTO.getTicketNumber());
        this.ticketDTO = ticketDTO;
        this.previousStatus = previousStatus;
        this.previousAssignee = previousAssignee;
        this.actorId = actorId;
    }

    public TicketStatus getNewStatus() {
        return ticketDTO.getStatus();
    }

    public boolean isAssigneeChanged() {
        return ticketDTO.getAssignedTo() != null && !ticketDTO.getAssignedTo().equals(previousAssignee);
    }

    @Override
    public String toString() {
        return String.format("TicketStatusChangedEvent[ticketId=%d, %s -> %s, actor=%d]",
                getTicketId(),
                previousStatus != null ? previousStatus.getValue() : null,
                getNewStatus() != null ? getNewStatus().getValue() : null,
                actorId);
    }
}
