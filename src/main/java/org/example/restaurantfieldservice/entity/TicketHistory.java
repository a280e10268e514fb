package org.example.restaurantfieldservice.entity;

import jakarta.persistence.*;
import lombok.*;
import org.example.restaurantfieldservice.enums.TicketStatus;

import java.time.LocalDateTime;

/**
 * Append-only audit row, one per status change or assignment.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "ticket_history", indexes = {
        @Index(name = "idx_history_ticket_id", columnList = "ticket_id")
})
public class TicketHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "ticket_id", nullable = false, updatable = false)
    private Long ticketId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 20, nullable = false, updatable = false)
    private TicketStatus status;

    @Column(name = "notes", columnDefinition = "TEXT", updatable = false)
    private String notes;

    @Column(name = "user_id", updatable = false)
    private Long userId;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private LocalDateTime timestamp;
}
