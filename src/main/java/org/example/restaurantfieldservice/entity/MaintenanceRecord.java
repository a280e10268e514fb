package org.example.restaurantfieldservice.entity;

import jakarta.persistence.*;
import lombok.*;
import org.example.restaurantfieldservice.enums.MaintenanceStatus;

import java.time.LocalDateTime;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "maintenance_records", indexes = {
        @Index(name = "idx_maintenance_device_id", columnList = "device_id"),
        @Index(name = "idx_maintenance_scheduled_date", columnList = "scheduled_date")
})
public class MaintenanceRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "device_id", nullable = false)
    private Long deviceId;

    @Column(name = "maintenance_type", length = 50, nullable = false)
    private String maintenanceType;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 20, nullable = false)
    @Builder.Default
    private MaintenanceStatus status = MaintenanceStatus.SCHEDULED;

    @Column(name = "scheduled_date", nullable = false)
    private LocalDateTime scheduledDate;

    @Column(name = "completed_date")
    private LocalDateTime completedDate;

    @Column(name = "technician_id")
    private Long technicianId;

    @Column(name = "notes", columnDefinition = "TEXT")
    private String notes;
}
