package org.example.restaurantfieldservice.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TicketScheduleRequest {

    /** Free text such as "Scheduled for tomorrow". */
    @NotBlank(message = "Schedule note is required")
    @Size(max = 255)
    private String when;
}
