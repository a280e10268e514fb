package org.example.restaurantfieldservice.offline;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.example.restaurantfieldservice.enums.TicketStatus;

import java.time.LocalDateTime;

/**
 * Queued history row, written with the time it was recorded offline.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HistoryEntryPatch {

    private TicketStatus status;
    private String notes;
    private Long userId;
    private LocalDateTime timestamp;
}
