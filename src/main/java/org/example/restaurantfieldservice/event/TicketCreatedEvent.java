package org.example.restaurantfieldservice.event;

import lombok.Getter;
import org.example.restaurantfieldservice.dto.TicketDTO;

/**
 * A ticket was opened, through either the standard or the helpdesk path.
 */
@Getter
public class TicketCreatedEvent extends TicketEvent {

    private final TicketDTO ticketDTO;

    public TicketCreatedEvent(Object source, TicketDTO ticketDTO) {
        super(source, ticketDTO.getId(), ticketDTO.getTicketNumber());
        this.ticketDTO = ticketDTO;
    }

    @Override
    public String toString() {
        return String.format("TicketCreatedEvent[ticketId=%d, ticketNumber=%s, source=%s]",
                getTicketId(), getTicketNumber(), ticketDTO.getSource());
    }
}
