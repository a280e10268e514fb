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
public class HealthStatusDTO {

    private String status;
    private boolean databaseReachable;
    private boolean online;
    private long pendingOfflineActions;
    private LocalDateTime checkedAt;
}
