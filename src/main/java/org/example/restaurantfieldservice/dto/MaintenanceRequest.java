package org.example.restaurantfieldservice.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MaintenanceRequest {

    @NotNull(message = "Device ID is required")
    private Long deviceId;

    /** preventive, corrective, inspection, ... */
    @NotBlank(message = "Maintenance type is required")
    @Size(max = 50)
    private String maintenanceType;

    private String description;

    @NotNull(message = "Scheduled date is required")
    private LocalDateTime scheduledDate;

    private Long technicianId;
}
