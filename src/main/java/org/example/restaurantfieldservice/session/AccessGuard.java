package org.example.restaurantfieldservice.session;

import org.example.restaurantfieldservice.enums.UserRole;
import org.example.restaurantfieldservice.exception.PermissionDeniedException;

import java.util.Arrays;

/**
 * Role checks for endpoints outside the ticket lifecycle.
 */
public final class AccessGuard {

    private AccessGuard() {
    }

    public static void requireAnyRole(SessionContext session, String action, UserRole... roles) {
        if (session == null || session.getRole() == null
                || Arrays.stream(roles).noneMatch(role -> role == session.getRole())) {
            throw new PermissionDeniedException(String.format("Permission denied: %s requires one of %s",
                    action, Arrays.toString(roles)));
        }
    }

    public static void requireAdmin(SessionContext session, String action) {
        requireAnyRole(session, action, UserRole.ADMIN);
    }
}
