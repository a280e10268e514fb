package org.example.restaurantfieldservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * The four tabs of the technician home screen.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TechnicianDashboardDTO {

    private List<TicketDTO> available;
    private List<TicketDTO> assigned;
    private List<TicketDTO> scheduled;
    private List<TicketDTO> completed;
}
