package org.example.restaurantfieldservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InterventionDTO {

    private Long id;
    private Long ticketId;
    private Long technicianId;
    private String workPerformed;
    private String rootCause;
    private String resolution;
    private String preventiveMeasures;
    private Double timeSpentHours;
    private Boolean followUpRequired;
    private String followUpNotes;
    private BigDecimal totalCost;
    private LocalDateTime completedAt;
    private List<InventoryUsageDTO> partsUsed;
}
