package org.example.restaurantfieldservice.exception;

/**
 * Thrown when work is started on a ticket that has no assignee.
 */
public class TicketNotAssignedException extends FieldServiceException {

    private static final String ERROR_CODE = "TICKET_NOT_ASSIGNED";

    public TicketNotAssignedException(Long ticketId) {
        super("Ticket not assigned: ticket " + ticketId + " must be assigned before work can start", ERROR_CODE);
    }
}
