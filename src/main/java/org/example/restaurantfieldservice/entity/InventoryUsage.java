package org.example.restaurantfieldservice.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "inventory_usage", indexes = {
        @Index(name = "idx_usage_ticket_id", columnList = "ticket_id"),
        @Index(name = "idx_usage_equipment_id", columnList = "equipment_id")
})
public class InventoryUsage {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "equipment_id", nullable = false)
    private Long equipmentId;

    @Column(name = "ticket_id", nullable = false)
    private Long ticketId;

    @Column(name = "intervention_id")
    private Long interventionId;

    @Column(name = "quantity_used", nullable = false)
    private Integer quantityUsed;

    @Column(name = "cost_per_unit", precision = 10, scale = 2)
    private BigDecimal costPerUnit;

    @Column(name = "total_cost", precision = 10, scale = 2)
    private BigDecimal totalCost;

    @Column(name = "used_by")
    private Long usedBy;

    @Column(name = "used_at", nullable = false)
    private LocalDateTime usedAt;
}
