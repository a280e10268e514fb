package org.example.restaurantfieldservice.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.restaurantfieldservice.dto.DeviceDTO;
import org.example.restaurantfieldservice.dto.DeviceRequest;
import org.example.restaurantfieldservice.dto.DeviceStatusRequest;
import org.example.restaurantfieldservice.dto.MaintenanceRecordDTO;
import org.example.restaurantfieldservice.dto.PagedResponse;
import org.example.restaurantfieldservice.enums.DeviceStatus;
import org.example.restaurantfieldservice.service.DeviceService;
import org.example.restaurantfieldservice.service.MaintenanceService;
import org.example.restaurantfieldservice.session.SessionContext;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/devices")
@RequiredArgsConstructor
public class DeviceController {

    private final DeviceService deviceService;
    private final MaintenanceService maintenanceService;

    @GetMapping
    public ResponseEntity<PagedResponse<DeviceDTO>> getDevices(
            @RequestParam(required = false) DeviceStatus status,
            @RequestParam(required = false) Long restaurantId,
            @RequestParam(required = false) String type,
            @RequestParam(required = false) String search,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size,
            SessionContext session) {
        return ResponseEntity.ok(deviceService.getDevices(status, restaurantId, type, search, page, size));
    }

    @GetMapping("/{id:\\d+}")
    public ResponseEntity<DeviceDTO> getDevice(@PathVariable Long id, SessionContext session) {
        return ResponseEntity.ok(deviceService.getDevice(id));
    }

    @GetMapping("/serial/{serialNumber}")
    public ResponseEntity<DeviceDTO> getBySerialNumber(@PathVariable String serialNumber, SessionContext session) {
        return ResponseEntity.ok(deviceService.getBySerialNumber(serialNumber));
    }

    @GetMapping("/restaurant/{restaurantId}")
    public ResponseEntity<List<DeviceDTO>> getByRestaurant(@PathVariable Long restaurantId, SessionContext session) {
        return ResponseEntity.ok(deviceService.getByRestaurant(restaurantId));
    }

    @GetMapping("/{id:\\d+}/maintenance")
    public ResponseEntity<List<MaintenanceRecordDTO>> getMaintenance(@PathVariable Long id, SessionContext session) {
        return ResponseEntity.ok(maintenanceService.getForDevice(id));
    }

    @PostMapping
    public ResponseEntity<DeviceDTO> createDevice(@Valid @RequestBody DeviceRequest request, SessionContext session) {
        log.info("POST /api/devices - serial: {}", request.getSerialNumber());
        return new ResponseEntity<>(deviceService.createDevice(request, session), HttpStatus.CREATED);
    }

    @PutMapping("/{id:\\d+}")
    public ResponseEntity<DeviceDTO> updateDevice(@PathVariable Long id,
                                                  @Valid @RequestBody DeviceRequest request,
                                                  SessionContext session) {
        log.info("PUT /api/devices/{}", id);
        return ResponseEntity.ok(deviceService.updateDevice(id, request, session));
    }

    @PatchMapping("/{id:\\d+}/status")
    public ResponseEntity<DeviceDTO> updateStatus(@PathVariable Long id,
                                                  @Valid @RequestBody DeviceStatusRequest request,
                                                  SessionContext session) {
        log.info("PATCH /api/devices/{}/status - {}", id, request.getStatus());
        return ResponseEntity.ok(deviceService.updateStatus(id, request.getStatus(), session));
    }
}
