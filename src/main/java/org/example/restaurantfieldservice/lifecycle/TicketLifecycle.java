package org.example.restaurantfieldservice.lifecycle;

import lombok.extern.slf4j.Slf4j;
import org.example.restaurantfieldservice.entity.Ticket;
import org.example.restaurantfieldservice.enums.TicketStatus;
import org.example.restaurantfieldservice.exception.InvalidTicketOperationException;
import org.example.restaurantfieldservice.exception.TicketNotAssignedException;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Forward-only ticket state machine.
 *
 * <pre>
 * new -> assigned -> in-progress -> resolved -> closed
 *            \-> scheduled -/
 * </pre>
 *
 * <p>Requesting the status a ticket already has is accepted as a no-op so that
 * retried requests do not fail and do not write a second history row.</p>
 */
@Slf4j
@Component
public class TicketLifecycle {

    private static final Map<TicketStatus, Set<TicketStatus>> TRANSITIONS = new EnumMap<>(TicketStatus.class);

    static {
        TRANSITIONS.put(TicketStatus.NEW, EnumSet.of(TicketStatus.ASSIGNED));
        TRANSITIONS.put(TicketStatus.ASSIGNED, EnumSet.of(TicketStatus.IN_PROGRESS, TicketStatus.SCHEDULED));
        TRANSITIONS.put(TicketStatus.SCHEDULED, EnumSet.of(TicketStatus.IN_PROGRESS));
        TRANSITIONS.put(TicketStatus.IN_PROGRESS, EnumSet.of(TicketStatus.RESOLVED));
        TRANSITIONS.put(TicketStatus.RESOLVED, EnumSet.of(TicketStatus.CLOSED));
        TRANSITIONS.put(TicketStatus.CLOSED, EnumSet.noneOf(TicketStatus.class));
    }

    /**
     * Statuses reachable in one step from {@code current}.
     */
    public Set<TicketStatus> nextStatuses(TicketStatus current) {
        return Collections.unmodifiableSet(TRANSITIONS.getOrDefault(current, EnumSet.noneOf(TicketStatus.class)));
    }

    public boolean isAllowed(TicketStatus from, TicketStatus to) {
        return nextStatuses(from).contains(to);
    }

    /**
     * Checks that {@code ticket} may move to {@code target}.
     *
     * @param resolution resolution text, only consulted when {@code target} is resolved
     * @return {@code false} when the ticket already has {@code target} and nothing should change
     * @throws TicketNotAssignedException      if the target needs an assignee and there is none
     * @throws InvalidTicketOperationException if the transition is not a forward step
     */
    public boolean validateTransition(Ticket ticket, TicketStatus target, String resolution) {
        if (target == null) {
            throw new IllegalArgumentException("Target status is required");
        }
        TicketStatus current = ticket.getStatus();

        if (current == target) {
            log.debug("Status unchanged for ticket {}: {}", ticket.getId(), current.getValue());
            return false;
        }

        if (requiresAssignee(target) && ticket.getAssignedTo() == null) {
            log.warn("Ticket {} has no assignee, cannot move to {}", ticket.getId(), target.getValue());
            throw new TicketNotAssignedException(ticket.getId());
        }

        if (!isAllowed(current, target)) {
            Set<TicketStatus> allowed = nextStatuses(current);
            throw new InvalidTicketOperationException("transition",
                    String.format("Cannot transition from '%s' to '%s'. Allowed: %s",
                            current.getValue(), target.getValue(), allowed.isEmpty() ? "none" : allowed));
        }

        if (target == TicketStatus.RESOLVED && !StringUtils.hasText(resolution)) {
            throw new InvalidTicketOperationException("resolve", "Resolution is required to resolve a ticket");
        }
        return true;
    }

    private boolean requiresAssignee(TicketStatus target) {
        return target == TicketStatus.ASSIGNED
                || target == TicketStatus.IN_PROGRESS
                || target == TicketStatus.SCHEDULED;
    }
}
