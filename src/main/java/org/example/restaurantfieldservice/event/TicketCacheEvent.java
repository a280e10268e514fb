package org.example.restaurantfieldservice.event;

import lombok.Getter;
import org.example.restaurantfieldservice.dto.TicketDTO;

/**
 * Populates the view cache after a read that missed it.
 */
@Getter
public class TicketCacheEvent extends TicketEvent {

    private final TicketDTO ticketDTO;

    public TicketCacheEvent(Object source, TicketDTO ticketDTO) {
        super(source, ticketDTO.getId(), ticketDTO.getTicketNumber());
        this.ticketDTO = ticketDTO;
    }

    @Override
    public String toString() {
        return String.format("TicketCacheEvent[ticketId=%d, ticketNumber=%s]", getTicketId(), getTicketNumber());
    }
}
