package org.example.restaurantfieldservice.offline;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.example.restaurantfieldservice.enums.OfflineActionType;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A write that could not reach the database, kept for replay.
 * Stored as one JSON element of the Redis list {@code offline:pending_actions}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OfflineAction implements Serializable {

    private static final long serialVersionUID = 1L;

    private String id;

    private OfflineActionType type;

    /**
     * Target table, {@code tickets} or {@code ticket_history}.
     */
    private String table;

    /**
     * Row the action applies to; for history inserts, the ticket.
     */
    private Long rowId;

    @Builder.Default
    private Map<String, Object> data = new LinkedHashMap<>();

    private LocalDateTime timestamp;

    private int retryCount;

    private String lastError;
}
