package org.example.restaurantfieldservice.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.restaurantfieldservice.dto.TicketDTO;
import org.example.restaurantfieldservice.entity.EquipmentItem;
import org.example.restaurantfieldservice.enums.TicketSource;
import org.example.restaurantfieldservice.enums.TicketStatus;
import org.example.restaurantfieldservice.kafka.dto.EntityChangeMessage;
import org.example.restaurantfieldservice.kafka.producer.EntityChangeKafkaProducer;
import org.example.restaurantfieldservice.lifecycle.SlaPolicy;
import org.example.restaurantfieldservice.repository.EquipmentItemRepository;
import org.example.restaurantfieldservice.service.NotificationService;
import org.example.restaurantfieldservice.service.TicketCacheService;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.List;

/**
 * Post-commit side effects of ticket and inventory changes: cache refresh,
 * notifications and the change stream.
 *
 * <p>Every handler runs after the primary transaction has committed and
 * catches its own failures, so a broken side effect never undoes the write
 * that triggered it.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TicketEventListener {

    private final TicketCacheService cacheService;
    private final NotificationService notificationService;
    private final EntityChangeKafkaProducer changeProducer;
    private final EquipmentItemRepository equipmentRepository;
    private final SlaPolicy slaPolicy;

    // ==================== CREATE EVENT HANDLER ====================

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleTicketCreated(TicketCreatedEvent event) {
        log.debug("📤 Processing TicketCreatedEvent: {}", event);
        TicketDTO ticket = event.getTicketDTO();

        try {
            cacheService.cacheTicket(ticket);
            log.info("✅ Cached newly created ticket - id: {}, ticketNumber: {}",
                    event.getTicketId(), event.getTicketNumber());
        } catch (Exception e) {
            log.warn("⚠️ Failed to cache created ticket {} - will be cached on next read: {}",
                    event.getTicketId(), e.getMessage());
        }

        try {
            int sent = ticket.getSource() == TicketSource.HELPDESK
                    ? notificationService.notifyFieldTicketAvailable(ticket)
                    : notificationService.notifyTicketCreated(ticket);
            log.info("🔔 {} notifications sent for new ticket {}", sent, event.getTicketNumber());
        } catch (Exception e) {
            log.warn("⚠️ Failed to notify about new ticket {}: {}", event.getTicketId(), e.getMessage());
        }
    }

    // ==================== UPDATE EVENT HANDLERS ====================

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleTicketUpdated(TicketUpdatedEvent event) {
        log.debug("📤 Processing TicketUpdatedEvent: {}", event);
        refreshCache(event.getTicketId(), event.getTicketNumber(), event.getTicketDTO());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleStatusChanged(TicketStatusChangedEvent event) {
        log.debug("📤 Processing TicketStatusChangedEvent: {}", event);
        TicketDTO ticket = event.getTicketDTO();
        refreshCache(event.getTicketId(), event.getTicketNumber(), ticket);

        try {
            if (event.isAssigneeChanged() && event.getNewStatus() == TicketStatus.ASSIGNED) {
                notificationService.notifyAssigned(ticket);
            } else {
                notificationService.notifyStatusChanged(ticket);
            }
            if (event.getNewStatus() == TicketStatus.RESOLVED) {
                notificationService.notifyResolved(ticket);
            }
        } catch (Exception e) {
            log.warn("⚠️ Failed to notify about status change of ticket {}: {}",
                    event.getTicketId(), e.getMessage());
        }
    }

    // ==================== CACHE POPULATION EVENT HANDLER ====================

    /**
     * Read transactions have nothing to commit, so cache-aside population
     * runs after completion instead.
     */
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMPLETION)
    public void handleTicketCache(TicketCacheEvent event) {
        log.debug("📤 Processing TicketCacheEvent: {}", event);

        try {
            cacheService.cacheTicket(event.getTicketDTO());
            log.debug("✅ Cached ticket after read - id: {}", event.getTicketId());
        } catch (Exception e) {
            log.warn("⚠️ Failed to cache ticket {} after read: {}", event.getTicketId(), e.getMessage());
        }
    }

    // ==================== CHANGE STREAM ====================

    /**
     * Also fires outside a transaction, for the offline replay path.
     */
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void handleEntityChange(EntityChangeEvent event) {
        try {
            changeProducer.send(EntityChangeMessage.from(event, slaPolicy.now()));
        } catch (Exception e) {
            log.warn("⚠️ Failed to publish {}: {}", event, e.getMessage());
        }
    }

    // ==================== INVENTORY ====================

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleInventoryConsumed(InventoryConsumedEvent event) {
        try {
            List<EquipmentItem> items = equipmentRepository.findAllById(event.getEquipmentIds());
            for (EquipmentItem item : items) {
                if (item.getMinStockLevel() != null && item.getStockLevel() != null
                        && item.getStockLevel() <= item.getMinStockLevel()) {
                    int sent = notificationService.notifyLowStock(item);
                    log.info("📉 Low stock on {} ({} left), {} users notified",
                            item.getName(), item.getStockLevel(), sent);
                }
            }
        } catch (Exception e) {
            log.warn("⚠️ Failed to check stock levels after ticket {}: {}", event.getTicketId(), e.getMessage());
        }
    }

    // ==================== ROLLBACK HANDLER ====================

    @TransactionalEventListener(phase = TransactionPhase.AFTER_ROLLBACK)
    public void handleRollback(TicketEvent event) {
        log.warn("🔄 Transaction rolled back for event: {} - no side effects", event);
    }

    private void refreshCache(Long ticketId, String ticketNumber, TicketDTO ticket) {
        try {
            cacheService.evictTicket(ticketId, ticketNumber);
            cacheService.cacheTicket(ticket);
            log.info("✅ Refreshed cache for ticket - id: {}, ticketNumber: {}", ticketId, ticketNumber);
        } catch (Exception e) {
            log.warn("⚠️ Failed to refresh cache for ticket {} - will be updated on next read: {}",
                    ticketId, e.getMessage());
        }
    }
}
