package org.example.restaurantfieldservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of inserting then deleting a throwaway ticket.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WriteProbeResult {

    private boolean success;
    private Long probeTicketId;
    private long elapsedMillis;
    private String error;
}
