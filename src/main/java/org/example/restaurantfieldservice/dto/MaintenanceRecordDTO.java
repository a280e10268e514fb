package org.example.restaurantfieldservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.example.restaurantfieldservice.enums.MaintenanceStatus;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MaintenanceRecordDTO {

    private Long id;
    private Long deviceId;
    private String maintenanceType;
    private String description;
    private MaintenanceStatus status;
    private LocalDateTime scheduledDate;
    private LocalDateTime completedDate;
    private Long technicianId;
    private String notes;
}
