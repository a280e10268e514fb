package org.example.restaurantfieldservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.example.restaurantfieldservice.enums.TicketPriority;
import org.example.restaurantfieldservice.enums.TicketSource;
import org.example.restaurantfieldservice.enums.TicketStatus;

import java.io.Serial;
import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Ticket view served to clients and held in the Redis view cache.
 * {@code pendingSync} is set when the change was queued offline and has not
 * reached the database yet.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TicketDTO implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    private Long id;
    private String ticketNumber;
    private String title;
    private String diagnosticInfo;
    private TicketStatus status;
    private TicketPriority priority;
    private TicketSource source;
    private Long deviceId;
    private Long restaurantId;
    private Long assignedTo;
    private Long createdBy;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime assignedAt;
    private LocalDateTime firstResponseAt;
    private LocalDateTime resolvedAt;
    private LocalDateTime closedAt;
    private LocalDateTime slaDueAt;
    private String resolution;
    private String scheduleNote;
    private String urgencyLevel;
    private String jiraTicketId;
    private String contactPerson;
    private String contactPhone;
    private Boolean requiresOnSite;
    private Double estimatedDurationHours;
    @Builder.Default
    private List<String> photos = new ArrayList<>();
    private boolean overdue;
    private boolean pendingSync;
}
