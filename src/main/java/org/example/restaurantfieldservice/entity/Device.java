package org.example.restaurantfieldservice.entity;

import jakarta.persistence.*;
import lombok.*;
import org.example.restaurantfieldservice.enums.DeviceStatus;

import java.time.LocalDateTime;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "devices", indexes = {
        @Index(name = "idx_device_restaurant_id", columnList = "restaurant_id"),
        @Index(name = "idx_device_status", columnList = "status")
})
public class Device {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", length = 150, nullable = false)
    private String name;

    @Column(name = "type", length = 50, nullable = false)
    private String type;

    @Column(name = "serial_number", length = 100, nullable = false, unique = true)
    private String serialNumber;

    @Column(name = "model", length = 100)
    private String model;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 20, nullable = false)
    @Builder.Default
    private DeviceStatus status = DeviceStatus.OPERATIONAL;

    @Column(name = "restaurant_id", nullable = false)
    private Long restaurantId;

    @Column(name = "installation_date")
    private LocalDateTime installationDate;

    @Column(name = "last_maintenance_at")
    private LocalDateTime lastMaintenanceAt;

    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        this.createdAt = LocalDateTime.now();
    }
}
