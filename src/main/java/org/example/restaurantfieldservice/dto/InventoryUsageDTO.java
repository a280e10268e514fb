package org.example.restaurantfieldservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InventoryUsageDTO {

    private Long id;
    private Long equipmentId;
    private Long ticketId;
    private Long interventionId;
    private Integer quantityUsed;
    private BigDecimal costPerUnit;
    private BigDecimal totalCost;
    private Long usedBy;
    private LocalDateTime usedAt;
}
