package org.example.restaurantfieldservice.lifecycle;

import lombok.RequiredArgsConstructor;
import org.example.restaurantfieldservice.entity.Ticket;
import org.example.restaurantfieldservice.enums.TicketStatus;
import org.example.restaurantfieldservice.exception.PermissionDeniedException;
import org.example.restaurantfieldservice.session.SessionContext;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Single place deciding who may move a ticket where. Every endpoint that
 * changes a ticket's status or assignee goes through here.
 */
@Component
@RequiredArgsConstructor
public class TicketAuthorizationPolicy {

    private final TicketLifecycle lifecycle;

    /**
     * Whether {@code user} may move {@code ticket} to {@code target}, given the
     * assignee the ticket would have afterwards.
     *
     * <ul>
     *   <li>new -> assigned: anyone assigning themselves, or an admin assigning anyone</li>
     *   <li>any move out of assigned or later: the current assignee or an admin</li>
     * </ul>
     */
    public boolean canTransition(SessionContext user, Ticket ticket, TicketStatus target, Long newAssignee) {
        return canTransition(user, ticket.getStatus(), ticket.getAssignedTo(), target, newAssignee);
    }

    /**
     * Same rule evaluated on a status and assignee pair, for callers holding a
     * cached view instead of the entity.
     */
    public boolean canTransition(SessionContext user, TicketStatus currentStatus, Long currentAssignee,
                                 TicketStatus target, Long newAssignee) {
        if (user == null || user.getUserId() == null) {
            return false;
        }
        if (user.isAdmin()) {
            return true;
        }
        if (currentStatus == TicketStatus.NEW && target == TicketStatus.ASSIGNED) {
            return Objects.equals(newAssignee, user.getUserId());
        }
        if (currentStatus == TicketStatus.NEW) {
            return false;
        }
        return Objects.equals(currentAssignee, user.getUserId());
    }

    public boolean canTransition(SessionContext user, Ticket ticket, TicketStatus target) {
        return canTransition(user, ticket, target, ticket.getAssignedTo());
    }

    public void requireTransition(SessionContext user, Ticket ticket, TicketStatus target, Long newAssignee) {
        if (!canTransition(user, ticket, target, newAssignee)) {
            throw new PermissionDeniedException(String.format(
                    "Permission denied: user %s may not move ticket %s from '%s' to '%s'",
                    user != null ? user.getUserId() : null, ticket.getTicketNumber(),
                    ticket.getStatus().getValue(), target.getValue()));
        }
    }

    /**
     * Targets {@code user} may request right now. Assigning to oneself is the
     * only way out of new for non-admins, so it is listed for any signed-in user.
     */
    public Set<TicketStatus> allowedTargets(SessionContext user, Ticket ticket) {
        Set<TicketStatus> allowed = EnumSet.noneOf(TicketStatus.class);
        for (TicketStatus target : lifecycle.nextStatuses(ticket.getStatus())) {
            Long assignee = target == TicketStatus.ASSIGNED && ticket.getAssignedTo() == null && user != null
                    ? user.getUserId()
                    : ticket.getAssignedTo();
            if (canTransition(user, ticket, target, assignee)) {
                allowed.add(target);
            }
        }
        return allowed;
    }
}
