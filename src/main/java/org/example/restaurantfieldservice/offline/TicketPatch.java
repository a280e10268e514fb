package org.example.restaurantfieldservice.offline;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.example.restaurantfieldservice.enums.TicketStatus;

import java.time.LocalDateTime;

/**
 * Queued ticket update. Only non-null fields are written on replay.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TicketPatch {

    private TicketStatus status;
    private Long assignedTo;
    private LocalDateTime assignedAt;
    private LocalDateTime firstResponseAt;
    private LocalDateTime resolvedAt;
    private LocalDateTime closedAt;
    private String resolution;
    private String scheduleNote;
}
