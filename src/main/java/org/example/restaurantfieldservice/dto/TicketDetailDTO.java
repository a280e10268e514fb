package org.example.restaurantfieldservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.example.restaurantfieldservice.enums.TicketStatus;

import java.util.List;
import java.util.Set;

/**
 * Ticket detail screen: the ticket plus the rows it references.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TicketDetailDTO {

    private TicketDTO ticket;
    private DeviceDTO device;
    private RestaurantDTO restaurant;
    private UserDTO assignee;
    private List<TicketHistoryDTO> history;
    private List<TicketCommentDTO> comments;
    private InterventionDTO intervention;
    private Set<TicketStatus> allowedTransitions;
}
