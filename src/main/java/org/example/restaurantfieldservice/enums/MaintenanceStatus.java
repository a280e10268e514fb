package org.example.restaurantfieldservice.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MaintenanceStatus {
    SCHEDULED,
    COMPLETED;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
