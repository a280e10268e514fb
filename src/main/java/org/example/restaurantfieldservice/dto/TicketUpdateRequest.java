package org.example.restaurantfieldservice.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.example.restaurantfieldservice.enums.TicketPriority;

/**
 * Edit of descriptive fields. Status and assignee change only through the
 * lifecycle endpoints.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TicketUpdateRequest {

    @Size(max = 255, message = "Title must not exceed 255 characters")
    private String title;

    @Size(max = 5000, message = "Diagnostic info must not exceed 5000 characters")
    private String diagnosticInfo;

    private TicketPriority priority;
}
