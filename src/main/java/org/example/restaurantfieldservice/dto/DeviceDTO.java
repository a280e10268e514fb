package org.example.restaurantfieldservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.example.restaurantfieldservice.enums.DeviceStatus;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceDTO {

    private Long id;
    private String name;
    private String type;
    private String serialNumber;
    private String model;
    private DeviceStatus status;
    private Long restaurantId;
    private LocalDateTime installationDate;
    private LocalDateTime lastMaintenanceAt;
}
