package org.example.restaurantfieldservice.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Completion report filed by the technician when the fix is done.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InterventionRequest {

    @NotBlank(message = "Work performed is required")
    private String workPerformed;

    private String rootCause;

    @NotBlank(message = "Resolution is required")
    private String resolution;

    private String preventiveMeasures;

    @PositiveOrZero
    private Double timeSpentHours;

    private Boolean followUpRequired;

    private String followUpNotes;

    /** Labor or travel cost on top of the parts consumed. */
    @PositiveOrZero
    private BigDecimal additionalCost;

    @Valid
    @Builder.Default
    private List<PartUsage> parts = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PartUsage {

        @NotNull(message = "Equipment ID is required")
        private Long equipmentId;

        @NotNull(message = "Quantity is required")
        private Integer quantity;
    }
}
