package org.example.restaurantfieldservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one replay pass over the offline queue.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncResult {

    private boolean success;
    private int syncedActions;
    private int failedActions;
    private int droppedActions;
    @Builder.Default
    private List<String> errors = new ArrayList<>();
    private LocalDateTime syncTime;

    public static SyncResult empty(LocalDateTime syncTime) {
        return SyncResult.builder().success(true).syncTime(syncTime).build();
    }
}
