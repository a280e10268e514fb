package org.example.restaurantfieldservice.lifecycle;

import lombok.RequiredArgsConstructor;
import org.example.restaurantfieldservice.enums.TicketPriority;
import org.example.restaurantfieldservice.enums.TicketStatus;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.Map;

/**
 * SLA due-date arithmetic. The deadline is computed once, at creation, as
 * {@code now + offset} and stored on the ticket.
 *
 * <p>Two tables exist: the standard creation path and the helpdesk intake path.
 * They disagree for critical and medium priorities and are kept apart on purpose.</p>
 */
@Component
@RequiredArgsConstructor
public class SlaPolicy {

    private static final Map<TicketPriority, Duration> STANDARD_OFFSETS = new EnumMap<>(TicketPriority.class);

    static {
        STANDARD_OFFSETS.put(TicketPriority.CRITICAL, Duration.ofHours(1));
        STANDARD_OFFSETS.put(TicketPriority.HIGH, Duration.ofHours(4));
        STANDARD_OFFSETS.put(TicketPriority.MEDIUM, Duration.ofHours(24));
        STANDARD_OFFSETS.put(TicketPriority.LOW, Duration.ofDays(3));
    }

    private final Clock clock;

    // ==================== OFFSETS ====================

    public Duration standardOffset(TicketPriority priority) {
        return STANDARD_OFFSETS.getOrDefault(priority, Duration.ofHours(24));
    }

    /**
     * Helpdesk offsets look at both priority and the caller-reported urgency;
     * the more urgent of the two wins.
     */
    public Duration helpdeskOffset(TicketPriority priority, String urgencyLevel) {
        String urgency = urgencyLevel == null ? "" : urgencyLevel.trim().toLowerCase();
        if (priority == TicketPriority.CRITICAL || "critical".equals(urgency)) {
            return Duration.ofHours(2);
        }
        if (priority == TicketPriority.HIGH || "high".equals(urgency)) {
            return Duration.ofHours(4);
        }
        if (priority == TicketPriority.MEDIUM || "normal".equals(urgency)) {
            return Duration.ofHours(8);
        }
        return Duration.ofHours(24);
    }

    // ==================== DUE DATES ====================

    public LocalDateTime standardDueDate(TicketPriority priority) {
        return now().plus(standardOffset(priority));
    }

    public LocalDateTime helpdeskDueDate(TicketPriority priority, String urgencyLevel) {
        return now().plus(helpdeskOffset(priority, urgencyLevel));
    }

    /**
     * A ticket is overdue while open past its deadline. Resolved and closed tickets never are.
     */
    public boolean isOverdue(LocalDateTime slaDueAt, TicketStatus status) {
        if (slaDueAt == null || status == null || status.isTerminal()) {
            return false;
        }
        return now().isAfter(slaDueAt);
    }

    public LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
