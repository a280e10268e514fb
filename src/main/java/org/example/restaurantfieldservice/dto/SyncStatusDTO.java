package org.example.restaurantfieldservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncStatusDTO {

    private boolean online;
    private long pendingActions;
    private LocalDateTime lastSyncTime;
    private SyncResult lastResult;
}
