package org.example.restaurantfieldservice.command;

import org.example.restaurantfieldservice.dto.TicketDTO;
import org.example.restaurantfieldservice.enums.TicketStatus;
import org.example.restaurantfieldservice.session.SessionContext;

/**
 * Books an assigned ticket for a later visit.
 */
public class ScheduleTicketCommand extends TransitionTicketCommand {

    private final String when;

    ScheduleTicketCommand(TicketCommandContext context, SessionContext session, Long ticketId, String when) {
        super(context, session, ticketId, TicketStatus.SCHEDULED, "Scheduled for " + when, null);
        this.when = when;
    }

    @Override
    public String description() {
        return "schedule ticket " + ticketId + " for " + when;
    }

    @Override
    public TicketDTO executeRemote() {
        return ticketService.scheduleTicket(ticketId, when, session);
    }
}
