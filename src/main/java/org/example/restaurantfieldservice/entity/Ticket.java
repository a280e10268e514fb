package org.example.restaurantfieldservice.entity;

import jakarta.persistence.*;
import lombok.*;
import org.example.restaurantfieldservice.enums.TicketPriority;
import org.example.restaurantfieldservice.enums.TicketSource;
import org.example.restaurantfieldservice.enums.TicketStatus;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(
        name = "tickets",
        indexes = {
                @Index(name = "idx_ticket_status", columnList = "status"),
                @Index(name = "idx_ticket_priority", columnList = "priority"),
                @Index(name = "idx_ticket_created_at", columnList = "created_at"),
                @Index(name = "idx_ticket_assigned_to", columnList = "assigned_to"),
                @Index(name = "idx_ticket_restaurant_id", columnList = "restaurant_id"),
                @Index(name = "idx_ticket_sla_due_at", columnList = "sla_due_at")
        }
)
public class Ticket {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "ticket_number", length = 50, nullable = false, unique = true)
    private String ticketNumber;

    @Column(name = "title", length = 255, nullable = false)
    private String title;

    @Column(name = "diagnostic_info", columnDefinition = "TEXT")
    private String diagnosticInfo;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 20, nullable = false)
    private TicketStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority", length = 20, nullable = false)
    private TicketPriority priority;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", length = 20, nullable = false)
    @Builder.Default
    private TicketSource source = TicketSource.STANDARD;

    @Column(name = "device_id", nullable = false)
    private Long deviceId;

    @Column(name = "restaurant_id", nullable = false)
    private Long restaurantId;

    @Column(name = "assigned_to")
    private Long assignedTo;

    @Column(name = "created_by")
    private Long createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Column(name = "assigned_at")
    private LocalDateTime assignedAt;

    @Column(name = "first_response_at")
    private LocalDateTime firstResponseAt;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;

    @Column(name = "closed_at")
    private LocalDateTime closedAt;

    @Column(name = "sla_due_at", nullable = false)
    private LocalDateTime slaDueAt;

    @Column(name = "resolution", columnDefinition = "TEXT")
    private String resolution;

    @Column(name = "schedule_note", length = 255)
    private String scheduleNote;

    // Helpdesk intake fields
    @Column(name = "urgency_level", length = 20)
    private String urgencyLevel;

    @Column(name = "jira_ticket_id", length = 50)
    private String jiraTicketId;

    @Column(name = "contact_person", length = 100)
    private String contactPerson;

    @Column(name = "contact_phone", length = 30)
    private String contactPhone;

    @Column(name = "requires_on_site")
    private Boolean requiresOnSite;

    @Column(name = "estimated_duration_hours")
    private Double estimatedDurationHours;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "ticket_photos", joinColumns = @JoinColumn(name = "ticket_id"))
    @OrderColumn(name = "position")
    @Column(name = "url", length = 1024)
    @Builder.Default
    private List<String> photos = new ArrayList<>();

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now();
        }
        this.updatedAt = this.createdAt;
        if (this.status == null) {
            this.status = TicketStatus.NEW;
        }
        if (this.priority == null) {
            this.priority = TicketPriority.MEDIUM;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = LocalDateTime.now();
    }
}
