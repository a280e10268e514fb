package org.example.restaurantfieldservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.example.restaurantfieldservice.enums.MovementType;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EquipmentMovementDTO {

    private Long id;
    private Long equipmentId;
    private MovementType movementType;
    private Integer quantity;
    private String reason;
    private String notes;
    private Integer previousStock;
    private Integer newStock;
    private Long userId;
    private LocalDateTime timestamp;
}
