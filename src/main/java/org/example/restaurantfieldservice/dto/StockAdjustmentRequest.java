package org.example.restaurantfieldservice.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Signed correction to a stock level (restock or write-off).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StockAdjustmentRequest {

    @NotNull(message = "Delta is required")
    private Integer delta;

    private String reason;

    private String notes;
}
