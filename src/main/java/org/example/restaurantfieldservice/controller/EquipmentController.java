package org.example.restaurantfieldservice.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.restaurantfieldservice.dto.EquipmentItemDTO;
import org.example.restaurantfieldservice.dto.EquipmentItemRequest;
import org.example.restaurantfieldservice.dto.EquipmentMovementDTO;
import org.example.restaurantfieldservice.dto.StockAdjustmentRequest;
import org.example.restaurantfieldservice.service.EquipmentService;
import org.example.restaurantfieldservice.session.SessionContext;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/equipment")
@RequiredArgsConstructor
public class EquipmentController {

    private final EquipmentService equipmentService;

    @GetMapping
    public ResponseEntity<List<EquipmentItemDTO>> getItems(@RequestParam(required = false) String search,
                                                           SessionContext session) {
        return ResponseEntity.ok(equipmentService.getItems(search));
    }

    @GetMapping("/low-stock")
    public ResponseEntity<List<EquipmentItemDTO>> getLowStock(SessionContext session) {
        return ResponseEntity.ok(equipmentService.getLowStock());
    }

    @GetMapping("/{id:\\d+}")
    public ResponseEntity<EquipmentItemDTO> getItem(@PathVariable Long id, SessionContext session) {
        return ResponseEntity.ok(equipmentService.getItem(id));
    }

    @GetMapping("/{id:\\d+}/movements")
    public ResponseEntity<List<EquipmentMovementDTO>> getMovements(@PathVariable Long id, SessionContext session) {
        return ResponseEntity.ok(equipmentService.getMovements(id));
    }

    @PostMapping
    public ResponseEntity<EquipmentItemDTO> createItem(@Valid @RequestBody EquipmentItemRequest request,
                                                       SessionContext session) {
        log.info("POST /api/equipment - {}", request.getName());
        return new ResponseEntity<>(equipmentService.createItem(request, session), HttpStatus.CREATED);
    }

    @PutMapping("/{id:\\d+}")
    public ResponseEntity<EquipmentItemDTO> updateItem(@PathVariable Long id,
                                                       @Valid @RequestBody EquipmentItemRequest request,
                                                       SessionContext session) {
        log.info("PUT /api/equipment/{}", id);
        return ResponseEntity.ok(equipmentService.updateItem(id, request, session));
    }

    /**
     * POST /api/equipment/{id}/adjust - positive delta restocks, negative draws down.
     */
    @PostMapping("/{id:\\d+}/adjust")
    public ResponseEntity<EquipmentItemDTO> adjustStock(@PathVariable Long id,
                                                        @Valid @RequestBody StockAdjustmentRequest request,
                                                        SessionContext session) {
        log.info("POST /api/equipment/{}/adjust - delta: {}", id, request.getDelta());
        return ResponseEntity.ok(equipmentService.adjustStock(id, request.getDelta(), request.getReason(),
                request.getNotes(), session));
    }
}
