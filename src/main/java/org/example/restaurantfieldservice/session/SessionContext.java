package org.example.restaurantfieldservice.session;

import lombok.Builder;
import lombok.Value;
import org.example.restaurantfieldservice.enums.UserRole;

/**
 * Authenticated caller of a request. Resolved from the bearer token and passed
 * explicitly to every service method that needs the current user.
 */
@Value
@Builder
public class SessionContext {

    Long userId;
    String email;
    String name;
    UserRole role;

    public boolean isAdmin() {
        return role == UserRole.ADMIN;
    }

    public boolean isManagerOrAdmin() {
        return role == UserRole.ADMIN || role == UserRole.MANAGER;
    }
}
