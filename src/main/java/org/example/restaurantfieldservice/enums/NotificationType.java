package org.example.restaurantfieldservice.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum NotificationType {
    INFO,
    SUCCESS,
    WARNING,
    ERROR;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
