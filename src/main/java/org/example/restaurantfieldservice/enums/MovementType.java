package org.example.restaurantfieldservice.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Direction of a manual stock movement.
 */
public enum MovementType {
    IN,
    OUT;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
