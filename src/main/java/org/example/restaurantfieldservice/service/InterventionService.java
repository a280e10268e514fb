package org.example.restaurantfieldservice.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.restaurantfieldservice.dto.InterventionDTO;
import org.example.restaurantfieldservice.dto.InterventionRequest;
import org.example.restaurantfieldservice.entity.EquipmentItem;
import org.example.restaurantfieldservice.entity.Intervention;
import org.example.restaurantfieldservice.entity.InventoryUsage;
import org.example.restaurantfieldservice.entity.Ticket;
import org.example.restaurantfieldservice.enums.ChangeOperation;
import org.example.restaurantfieldservice.enums.TicketStatus;
import org.example.restaurantfieldservice.event.EntityChangeEvent;
import org.example.restaurantfieldservice.event.InventoryConsumedEvent;
import org.example.restaurantfieldservice.exception.InvalidTicketOperationException;
import org.example.restaurantfieldservice.exception.ResourceNotFoundException;
import org.example.restaurantfieldservice.lifecycle.SlaPolicy;
import org.example.restaurantfieldservice.lifecycle.TicketAuthorizationPolicy;
import org.example.restaurantfieldservice.lifecycle.TicketLifecycle;
import org.example.restaurantfieldservice.mapper.ResourceMapper;
import org.example.restaurantfieldservice.repository.EquipmentItemRepository;
import org.example.restaurantfieldservice.repository.InterventionRepository;
import org.example.restaurantfieldservice.repository.InventoryUsageRepository;
import org.example.restaurantfieldservice.repository.TicketRepository;
import org.example.restaurantfieldservice.session.SessionContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Completes the work on a ticket: records the intervention, draws the parts
 * out of stock and resolves the ticket, all in one transaction.
 *
 * <p>Stock is decremented with a plain read-modify-write. Two technicians
 * consuming the same item at the same moment can lose one of the updates.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InterventionService {

    private final TicketRepository ticketRepository;
    private final InterventionRepository interventionRepository;
    private final InventoryUsageRepository usageRepository;
    private final EquipmentItemRepository equipmentRepository;
    private final TicketValidationService validationService;
    private final TicketLifecycle lifecycle;
    private final TicketAuthorizationPolicy authorizationPolicy;
    private final TicketService ticketService;
    private final ResourceMapper mapper;
    private final SlaPolicy slaPolicy;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Completing an already resolved ticket returns the recorded intervention
     * and consumes nothing.
     *
     * @throws InvalidTicketOperationException if a part is short on stock or the ticket cannot be resolved
     */
    @Transactional
    public InterventionDTO completeIntervention(Long ticketId, InterventionRequest request, SessionContext session) {
        validationService.validateInterventionRequest(ticketId, request);
        Ticket ticket = ticketRepository.findById(ticketId)
                .orElseThrow(() -> new ResourceNotFoundException("Ticket", ticketId));

        if (ticket.getStatus().isTerminal()) {
            return interventionRepository.findFirstByTicketIdOrderByCompletedAtDesc(ticketId)
                    .map(existing -> {
                        log.info("♻️ Ticket {} already {}, returning intervention {}",
                                ticket.getTicketNumber(), ticket.getStatus().getValue(), existing.getId());
                        return mapper.toDTO(existing, usageRepository.findByInterventionId(existing.getId()));
                    })
                    .orElseThrow(() -> new InvalidTicketOperationException("completeIntervention",
                            "Ticket is already " + ticket.getStatus().getValue()));
        }

        lifecycle.validateTransition(ticket, TicketStatus.RESOLVED, request.getResolution());
        authorizationPolicy.requireTransition(session, ticket, TicketStatus.RESOLVED, ticket.getAssignedTo());

        Map<Long, Integer> quantities = mergeLines(request.getParts());
        Map<Long, EquipmentItem> items = loadAndCheckStock(quantities);

        LocalDateTime now = slaPolicy.now();
        BigDecimal partsCost = BigDecimal.ZERO;
        for (Map.Entry<Long, Integer> line : quantities.entrySet()) {
            partsCost = partsCost.add(unitCost(items.get(line.getKey())).multiply(BigDecimal.valueOf(line.getValue())));
        }
        BigDecimal totalCost = partsCost.add(
                request.getAdditionalCost() != null ? request.getAdditionalCost() : BigDecimal.ZERO);

        Intervention intervention = interventionRepository.save(Intervention.builder()
                .ticketId(ticketId)
                .technicianId(session.getUserId())
                .workPerformed(request.getWorkPerformed().trim())
                .rootCause(request.getRootCause())
                .resolution(request.getResolution().trim())
                .preventiveMeasures(request.getPreventiveMeasures())
                .timeSpentHours(request.getTimeSpentHours())
                .followUpRequired(Boolean.TRUE.equals(request.getFollowUpRequired()))
                .followUpNotes(request.getFollowUpNotes())
                .totalCost(totalCost)
                .completedAt(now)
                .build());

        List<InventoryUsage> usages = consume(intervention, quantities, items, session.getUserId(), now);

        int itemsUsed = quantities.values().stream().mapToInt(Integer::intValue).sum();
        String note = String.format("Intervention completed. %d items used. Total cost: $%s",
                itemsUsed, totalCost.setScale(2, RoundingMode.HALF_UP));
        ticketService.transitionTicket(ticketId, TicketStatus.RESOLVED, note, request.getResolution(), session);

        eventPublisher.publishEvent(new EntityChangeEvent(this, "interventions", intervention.getId(), ChangeOperation.INSERT));
        if (!quantities.isEmpty()) {
            eventPublisher.publishEvent(new InventoryConsumedEvent(
                    this, ticketId, intervention.getId(), new ArrayList<>(quantities.keySet())));
        }

        log.info("🔧 Intervention {} completed on ticket {} - {} parts, total {}",
                intervention.getId(), ticket.getTicketNumber(), itemsUsed, totalCost);
        return mapper.toDTO(intervention, usages);
    }

    @Transactional(readOnly = true)
    public InterventionDTO getIntervention(Long ticketId) {
        validationService.validateId(ticketId, "Ticket ID");
        Intervention intervention = interventionRepository.findFirstByTicketIdOrderByCompletedAtDesc(ticketId)
                .orElseThrow(() -> new ResourceNotFoundException("Intervention", "ticketId", String.valueOf(ticketId)));
        return mapper.toDTO(intervention, usageRepository.findByInterventionId(intervention.getId()));
    }

    // ==================== HELPERS ====================

    private Map<Long, Integer> mergeLines(List<InterventionRequest.PartUsage> parts) {
        Map<Long, Integer> quantities = new LinkedHashMap<>();
        if (parts != null) {
            for (InterventionRequest.PartUsage part : parts) {
                quantities.merge(part.getEquipmentId(), part.getQuantity(), Integer::sum);
            }
        }
        return quantities;
    }

    private Map<Long, EquipmentItem> loadAndCheckStock(Map<Long, Integer> quantities) {
        Map<Long, EquipmentItem> items = new LinkedHashMap<>();
        for (Map.Entry<Long, Integer> line : quantities.entrySet()) {
            EquipmentItem item = equipmentRepository.findById(line.getKey())
                    .orElseThrow(() -> new ResourceNotFoundException("Equipment", line.getKey()));
            int stock = item.getStockLevel() != null ? item.getStockLevel() : 0;
            if (line.getValue() > stock) {
                throw new InvalidTicketOperationException("consumeInventory", String.format(
                        "Insufficient stock for %s: requested %d, available %d", item.getName(), line.getValue(), stock));
            }
            items.put(item.getId(), item);
        }
        return items;
    }

    private List<InventoryUsage> consume(Intervention intervention, Map<Long, Integer> quantities,
                                         Map<Long, EquipmentItem> items, Long userId, LocalDateTime now) {
        List<InventoryUsage> usages = new ArrayList<>();
        for (Map.Entry<Long, Integer> line : quantities.entrySet()) {
            EquipmentItem item = items.get(line.getKey());
            int quantity = line.getValue();

            item.setStockLevel(item.getStockLevel() - quantity);
            equipmentRepository.save(item);
            eventPublisher.publishEvent(new EntityChangeEvent(this, "equipment_inventory", item.getId(), ChangeOperation.UPDATE));

            BigDecimal costPerUnit = unitCost(item);
            InventoryUsage usage = usageRepository.save(InventoryUsage.builder()
                    .equipmentId(item.getId())
                    .ticketId(intervention.getTicketId())
                    .interventionId(intervention.getId())
                    .quantityUsed(quantity)
                    .costPerUnit(costPerUnit)
                    .totalCost(costPerUnit.multiply(BigDecimal.valueOf(quantity)))
                    .usedBy(userId)
                    .usedAt(now)
                    .build());
            usages.add(usage);
            log.debug("Consumed {} x {} (stock now {})", quantity, item.getName(), item.getStockLevel());
        }
        return usages;
    }

    private BigDecimal unitCost(EquipmentItem item) {
        return item.getUnitCost() != null ? item.getUnitCost() : BigDecimal.ZERO;
    }
}
