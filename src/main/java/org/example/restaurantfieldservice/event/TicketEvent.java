package org.example.restaurantfieldservice.event;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Base class for ticket domain events. Events are published inside the
 * service transaction and handled by {@link TicketEventListener} after commit.
 */
@Getter
public abstract class TicketEvent extends ApplicationEvent {

    private final Long ticketId;

    /**
     * Business key, used for the secondary cache entry.
     */
    private final String ticketNumber;

    protected TicketEvent(Object source, Long ticketId, String ticketNumber) {
        super(source);
        this.ticketId = ticketId;
        this.ticketNumber = ticketNumber;
    }
}
