package org.example.restaurantfieldservice.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.example.restaurantfieldservice.enums.DeviceStatus;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DeviceStatusRequest {

    @NotNull(message = "Status is required")
    private DeviceStatus status;
}
