package org.example.restaurantfieldservice.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.example.restaurantfieldservice.enums.TicketStatus;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TicketTransitionRequest {

    @NotNull(message = "Status is required")
    private TicketStatus status;

    private String notes;

    /** Required when moving to resolved. */
    private String resolution;
}
