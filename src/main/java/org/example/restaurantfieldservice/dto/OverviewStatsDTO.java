package org.example.restaurantfieldservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.example.restaurantfieldservice.enums.TicketStatus;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OverviewStatsDTO {

    private Map<TicketStatus, Long> ticketsByStatus;
    private long totalTickets;
    private long overdueTickets;
    private long lowStockItems;
    private long devicesInMaintenance;
}
