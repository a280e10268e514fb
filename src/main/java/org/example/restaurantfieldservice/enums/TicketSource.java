package org.example.restaurantfieldservice.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Creation path of a ticket; selects the SLA table.
 */
public enum TicketSource {
    STANDARD,
    HELPDESK;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
