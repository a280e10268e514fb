package org.example.restaurantfieldservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EquipmentItemDTO {

    private Long id;
    private String name;
    private String type;
    private Integer stockLevel;
    private Integer minStockLevel;
    private Integer maxStockLevel;
    private String warehouseLocation;
    private String supplier;
    private BigDecimal unitCost;
    private boolean lowStock;
}
