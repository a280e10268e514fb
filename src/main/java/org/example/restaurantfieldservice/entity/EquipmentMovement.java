package org.example.restaurantfieldservice.entity;

import jakarta.persistence.*;
import lombok.*;
import org.example.restaurantfieldservice.enums.MovementType;

import java.time.LocalDateTime;

/**
 * One manual restock or write-off, with the stock level on either side of it.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "equipment_movements", indexes = {
        @Index(name = "idx_movement_equipment_id", columnList = "equipment_id")
})
public class EquipmentMovement {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "equipment_id", nullable = false)
    private Long equipmentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "movement_type", length = 10, nullable = false)
    private MovementType movementType;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Column(name = "reason", length = 100)
    private String reason;

    @Column(name = "notes", columnDefinition = "TEXT")
    private String notes;

    @Column(name = "previous_stock", nullable = false)
    private Integer previousStock;

    @Column(name = "new_stock", nullable = false)
    private Integer newStock;

    @Column(name = "user_id")
    private Long userId;

    @Column(name = "timestamp", nullable = false)
    private LocalDateTime timestamp;
}
