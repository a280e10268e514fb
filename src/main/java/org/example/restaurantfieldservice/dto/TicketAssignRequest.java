package org.example.restaurantfieldservice.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TicketAssignRequest {

    @NotNull(message = "Assignee ID is required")
    private Long assigneeId;

    private String notes;
}
