package org.example.restaurantfieldservice.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.example.restaurantfieldservice.enums.TicketPriority;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TicketCreateRequest {

    @Size(max = 50, message = "Ticket number must not exceed 50 characters")
    private String ticketNumber;

    @NotBlank(message = "Title is required")
    @Size(max = 255, message = "Title must not exceed 255 characters")
    private String title;

    @Size(max = 5000, message = "Diagnostic info must not exceed 5000 characters")
    private String diagnosticInfo;

    @NotNull(message = "Priority is required")
    private TicketPriority priority;

    @NotNull(message = "Device ID is required")
    private Long deviceId;

    @NotNull(message = "Restaurant ID is required")
    private Long restaurantId;

    private List<String> photos;
}
