package org.example.restaurantfieldservice.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.restaurantfieldservice.dto.MaintenanceCompleteRequest;
import org.example.restaurantfieldservice.dto.MaintenanceRecordDTO;
import org.example.restaurantfieldservice.dto.MaintenanceRequest;
import org.example.restaurantfieldservice.service.MaintenanceService;
import org.example.restaurantfieldservice.session.SessionContext;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/maintenance")
@RequiredArgsConstructor
public class MaintenanceController {

    private final MaintenanceService maintenanceService;

    @GetMapping("/upcoming")
    public ResponseEntity<List<MaintenanceRecordDTO>> getUpcoming(@RequestParam(defaultValue = "30") int days,
                                                                  SessionContext session) {
        return ResponseEntity.ok(maintenanceService.getUpcoming(days));
    }

    @PostMapping
    public ResponseEntity<MaintenanceRecordDTO> schedule(@Valid @RequestBody MaintenanceRequest request,
                                                         SessionContext session) {
        log.info("POST /api/maintenance - device: {}", request.getDeviceId());
        return new ResponseEntity<>(maintenanceService.schedule(request, session), HttpStatus.CREATED);
    }

    @PostMapping("/{id:\\d+}/complete")
    public ResponseEntity<MaintenanceRecordDTO> complete(@PathVariable Long id,
                                                         @RequestBody(required = false) MaintenanceCompleteRequest request,
                                                         SessionContext session) {
        log.info("POST /api/maintenance/{}/complete", id);
        String notes = request != null ? request.getNotes() : null;
        return ResponseEntity.ok(maintenanceService.complete(id, notes, session));
    }
}
