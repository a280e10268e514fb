package org.example.restaurantfieldservice.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DeviceStatus {
    OPERATIONAL("operational"),
    MAINTENANCE("maintenance"),
    OFFLINE("offline");

    private final String value;

    DeviceStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static DeviceStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (DeviceStatus status : values()) {
            if (status.value.equalsIgnoreCase(value.trim())) {
                return status;
            }
        }
        throw new IllegalArgumentException("Invalid device status: " + value);
    }
}
