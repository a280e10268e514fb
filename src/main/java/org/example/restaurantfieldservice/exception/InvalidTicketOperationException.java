package org.example.restaurantfieldservice.exception;

/**
 * Thrown when an operation is not allowed in the ticket's current state,
 * for example a backward status transition.
 */
public class InvalidTicketOperationException extends FieldServiceException {

    private static final String ERROR_CODE = "INVALID_TICKET_OPERATION";

    public InvalidTicketOperationException(String message) {
        super(message, ERROR_CODE);
    }

    public InvalidTicketOperationException(String operation, String reason) {
        super("Cannot perform operation '" + operation + "': " + reason, ERROR_CODE);
    }
}
