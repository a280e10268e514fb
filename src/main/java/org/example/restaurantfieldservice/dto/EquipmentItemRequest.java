package org.example.restaurantfieldservice.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EquipmentItemRequest {

    @NotBlank(message = "Item name is required")
    @Size(max = 150)
    private String name;

    @Size(max = 50)
    private String type;

    @NotNull(message = "Stock level is required")
    @PositiveOrZero
    private Integer stockLevel;

    @PositiveOrZero
    private Integer minStockLevel;

    @PositiveOrZero
    private Integer maxStockLevel;

    @Size(max = 100)
    private String warehouseLocation;

    @Size(max = 150)
    private String supplier;

    @PositiveOrZero
    private BigDecimal unitCost;
}
