package org.example.restaurantfieldservice.event;

import lombok.Getter;
import org.example.restaurantfieldservice.dto.TicketDTO;

/**
 * Descriptive fields, photos or replayed offline changes were written.
 */
@Getter
public class TicketUpdatedEvent extends TicketEvent {

    private final TicketDTO ticketDTO;

    public TicketUpdatedEvent(Object source, TicketDTO ticketDTO) {
        super(source, ticketDTO.getId(), ticketDTO.getTicketNumber());
        this.ticketDTO = ticketDTO;
    }

    @Override
    public String toString() {
        return String.format("TicketUpdatedEvent[ticketId=%d, ticketNumber=%s]", getTicketId(), getTicketNumber());
    }
}
