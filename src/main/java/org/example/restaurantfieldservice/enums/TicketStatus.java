package org.example.restaurantfieldservice.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle states of a field ticket. The wire value is the lowercase form
 * used by the mobile clients ("in-progress" rather than IN_PROGRESS).
 */
public enum TicketStatus {
    NEW("new"),
    ASSIGNED("assigned"),
    IN_PROGRESS("in-progress"),
    SCHEDULED("scheduled"),
    RESOLVED("resolved"),
    CLOSED("closed");

    private final String value;

    TicketStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == RESOLVED || this == CLOSED;
    }

    @JsonCreator
    public static TicketStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim();
        for (TicketStatus status : values()) {
            if (status.value.equalsIgnoreCase(normalized) || status.name().equalsIgnoreCase(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Invalid status: " + value + ". Valid values: new, assigned, "
                + "in-progress, scheduled, resolved, closed");
    }
}
