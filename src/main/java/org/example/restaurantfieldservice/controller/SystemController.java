package org.example.restaurantfieldservice.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.restaurantfieldservice.dto.HealthStatusDTO;
import org.example.restaurantfieldservice.dto.WriteProbeResult;
import org.example.restaurantfieldservice.service.SystemHealthService;
import org.example.restaurantfieldservice.session.SessionContext;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/system")
@RequiredArgsConstructor
public class SystemController {

    private final SystemHealthService healthService;

    /**
     * Unauthenticated so load balancers can poll it.
     */
    @GetMapping("/health")
    public ResponseEntity<HealthStatusDTO> health() {
        HealthStatusDTO health = healthService.health();
        HttpStatus status = health.isDatabaseReachable() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return new ResponseEntity<>(health, status);
    }

    @PostMapping("/write-probe")
    public ResponseEntity<WriteProbeResult> writeProbe(SessionContext session) {
        log.info("POST /api/system/write-probe - user {}", session.getUserId());
        return ResponseEntity.ok(healthService.writeProbe(session));
    }
}
