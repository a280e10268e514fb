package org.example.restaurantfieldservice.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
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
public class DeviceRequest {

    @NotBlank(message = "Device name is required")
    @Size(max = 150)
    private String name;

    @NotBlank(message = "Device type is required")
    @Size(max = 50)
    private String type;

    @NotBlank(message = "Serial number is required")
    @Size(max = 100)
    private String serialNumber;

    @Size(max = 100)
    private String model;

    private DeviceStatus status;

    @NotNull(message = "Restaurant ID is required")
    private Long restaurantId;

    private LocalDateTime installationDate;
}
