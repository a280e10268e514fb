package org.example.restaurantfieldservice.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum UserRole {
    TECHNICIAN("technician"),
    SOFTWARE_TECH("software_tech"),
    ADMIN("admin"),
    MANAGER("manager"),
    RESTAURANT_STAFF("restaurant_staff"),
    WAREHOUSE("warehouse");

    private final String value;

    UserRole(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Roles that pick up field tickets. */
    public boolean isTechnician() {
        return this == TECHNICIAN || this == SOFTWARE_TECH;
    }

    @JsonCreator
    public static UserRole fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (UserRole role : values()) {
            if (role.value.equalsIgnoreCase(value.trim()) || role.name().equalsIgnoreCase(value.trim())) {
                return role;
            }
        }
        throw new IllegalArgumentException("Invalid role: " + value);
    }
}
