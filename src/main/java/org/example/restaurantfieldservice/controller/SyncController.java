package org.example.restaurantfieldservice.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.restaurantfieldservice.dto.SyncResult;
import org.example.restaurantfieldservice.dto.SyncStatusDTO;
import org.example.restaurantfieldservice.offline.OfflineSyncService;
import org.example.restaurantfieldservice.session.SessionContext;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/sync")
@RequiredArgsConstructor
public class SyncController {

    private final OfflineSyncService syncService;

    @GetMapping("/status")
    public ResponseEntity<SyncStatusDTO> getStatus(SessionContext session) {
        return ResponseEntity.ok(syncService.getStatus());
    }

    /**
     * Replays the offline queue now instead of waiting for the next scheduled pass.
     */
    @PostMapping("/replay")
    public ResponseEntity<SyncResult> replay(SessionContext session) {
        log.info("POST /api/sync/replay - requested by user {}", session.getUserId());
        return ResponseEntity.ok(syncService.syncPendingActions());
    }
}
