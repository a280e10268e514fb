package org.example.restaurantfieldservice.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.restaurantfieldservice.dto.EquipmentItemDTO;
import org.example.restaurantfieldservice.dto.EquipmentItemRequest;
import org.example.restaurantfieldservice.dto.EquipmentMovementDTO;
import org.example.restaurantfieldservice.entity.EquipmentItem;
import org.example.restaurantfieldservice.entity.EquipmentMovement;
import org.example.restaurantfieldservice.enums.ChangeOperation;
import org.example.restaurantfieldservice.enums.MovementType;
import org.example.restaurantfieldservice.enums.UserRole;
import org.example.restaurantfieldservice.event.EntityChangeEvent;
import org.example.restaurantfieldservice.event.InventoryConsumedEvent;
import org.example.restaurantfieldservice.exception.InvalidTicketOperationException;
import org.example.restaurantfieldservice.exception.ResourceNotFoundException;
import org.example.restaurantfieldservice.lifecycle.SlaPolicy;
import org.example.restaurantfieldservice.mapper.ResourceMapper;
import org.example.restaurantfieldservice.repository.EquipmentItemRepository;
import org.example.restaurantfieldservice.repository.EquipmentMovementRepository;
import org.example.restaurantfieldservice.session.AccessGuard;
import org.example.restaurantfieldservice.session.SessionContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * Warehouse stock. Consumption by interventions goes through
 * {@link InterventionService}; this service covers catalogue edits and
 * manual restock or write-off, each recorded in {@code equipment_movements}.
 */
@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class EquipmentService {

    static final String TABLE = "equipment_inventory";
    static final String MOVEMENTS_TABLE = "equipment_movements";

    private final EquipmentItemRepository equipmentRepository;
    private final EquipmentMovementRepository movementRepository;
    private final ResourceMapper mapper;
    private final ApplicationEventPublisher eventPublisher;
    private final SlaPolicy slaPolicy;

    @Transactional(readOnly = true)
    public List<EquipmentItemDTO> getItems(String search) {
        List<EquipmentItem> items = StringUtils.hasText(search)
                ? equipmentRepository.findByNameContainingIgnoreCaseOrderByNameAsc(search.trim())
                : equipmentRepository.findAll(Sort.by("name").ascending());
        return items.stream().map(mapper::toDTO).toList();
    }

    @Transactional(readOnly = true)
    public EquipmentItemDTO getItem(Long id) {
        return mapper.toDTO(findItem(id));
    }

    /**
     * Restocks and write-offs of one item, newest first.
     */
    @Transactional(readOnly = true)
    public List<EquipmentMovementDTO> getMovements(Long id) {
        if (!equipmentRepository.existsById(id)) {
            throw new ResourceNotFoundException("Equipment", id);
        }
        return movementRepository.findByEquipmentIdOrderByTimestampDesc(id).stream()
                .map(mapper::toDTO)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<EquipmentItemDTO> getLowStock() {
        return equipmentRepository.findLowStock().stream().map(mapper::toDTO).toList();
    }

    public EquipmentItemDTO createItem(EquipmentItemRequest request, SessionContext session) {
        requireStockRole(session, "create equipment");
        EquipmentItem item = new EquipmentItem();
        apply(item, request);
        EquipmentItem saved = equipmentRepository.save(item);
        eventPublisher.publishEvent(new EntityChangeEvent(this, TABLE, saved.getId(), ChangeOperation.INSERT));
        log.info("✅ Equipment created - id: {}, name: {}", saved.getId(), saved.getName());
        return mapper.toDTO(saved);
    }

    public EquipmentItemDTO updateItem(Long id, EquipmentItemRequest request, SessionContext session) {
        requireStockRole(session, "edit equipment");
        EquipmentItem item = findItem(id);
        apply(item, request);
        EquipmentItem saved = equipmentRepository.save(item);
        eventPublisher.publishEvent(new EntityChangeEvent(this, TABLE, saved.getId(), ChangeOperation.UPDATE));
        return mapper.toDTO(saved);
    }

    /**
     * Adds {@code delta} (negative for write-off) to the stock level, which may not go below zero,
     * and records the movement.
     */
    public EquipmentItemDTO adjustStock(Long id, int delta, String reason, String notes, SessionContext session) {
        requireStockRole(session, "adjust stock");
        if (delta == 0) {
            throw new IllegalArgumentException("Stock adjustment must be non-zero");
        }
        EquipmentItem item = findItem(id);
        int current = item.getStockLevel() != null ? item.getStockLevel() : 0;
        if (current + delta < 0) {
            throw new InvalidTicketOperationException("adjustStock", String.format(
                    "Stock for %s cannot go below zero (current %d, delta %d)", item.getName(), current, delta));
        }
        item.setStockLevel(current + delta);
        EquipmentItem saved = equipmentRepository.save(item);

        MovementType type = delta > 0 ? MovementType.IN : MovementType.OUT;
        EquipmentMovement movement = movementRepository.save(EquipmentMovement.builder()
                .equipmentId(saved.getId())
                .movementType(type)
                .quantity(Math.abs(delta))
                .reason(StringUtils.hasText(reason) ? reason.trim() : defaultReason(type))
                .notes(notes)
                .previousStock(current)
                .newStock(saved.getStockLevel())
                .userId(session.getUserId())
                .timestamp(slaPolicy.now())
                .build());

        eventPublisher.publishEvent(new EntityChangeEvent(this, TABLE, saved.getId(), ChangeOperation.UPDATE));
        eventPublisher.publishEvent(new EntityChangeEvent(this, MOVEMENTS_TABLE, movement.getId(), ChangeOperation.INSERT));
        if (delta < 0) {
            eventPublisher.publishEvent(new InventoryConsumedEvent(this, null, null, List.of(saved.getId())));
        }
        log.info("📦 Stock of {} adjusted {} -> {} by {} ({})",
                item.getName(), current, saved.getStockLevel(), session.getUserId(), movement.getReason());
        return mapper.toDTO(saved);
    }

    private static String defaultReason(MovementType type) {
        return type == MovementType.IN ? "Stock In" : "Stock Out";
    }

    private void requireStockRole(SessionContext session, String action) {
        AccessGuard.requireAnyRole(session, action, UserRole.ADMIN, UserRole.MANAGER, UserRole.WAREHOUSE);
    }

    private EquipmentItem findItem(Long id) {
        return equipmentRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Equipment", id));
    }

    private void apply(EquipmentItem item, EquipmentItemRequest request) {
        item.setName(request.getName().trim());
        item.setType(request.getType());
        item.setStockLevel(request.getStockLevel());
        item.setMinStockLevel(request.getMinStockLevel());
        item.setMaxStockLevel(request.getMaxStockLevel());
        item.setWarehouseLocation(request.getWarehouseLocation());
        item.setSupplier(request.getSupplier());
        item.setUnitCost(request.getUnitCost());
    }
}
