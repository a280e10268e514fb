package org.example.restaurantfieldservice.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.restaurantfieldservice.dto.NotificationDTO;
import org.example.restaurantfieldservice.dto.PagedResponse;
import org.example.restaurantfieldservice.dto.TicketDTO;
import org.example.restaurantfieldservice.entity.AppUser;
import org.example.restaurantfieldservice.entity.EquipmentItem;
import org.example.restaurantfieldservice.entity.Notification;
import org.example.restaurantfieldservice.enums.NotificationType;
import org.example.restaurantfieldservice.enums.TicketPriority;
import org.example.restaurantfieldservice.enums.UserRole;
import org.example.restaurantfieldservice.exception.PermissionDeniedException;
import org.example.restaurantfieldservice.exception.ResourceNotFoundException;
import org.example.restaurantfieldservice.mapper.ResourceMapper;
import org.example.restaurantfieldservice.repository.AppUserRepository;
import org.example.restaurantfieldservice.repository.NotificationRepository;
import org.example.restaurantfieldservice.repository.RestaurantRepository;
import org.example.restaurantfieldservice.session.SessionContext;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;

/**
 * In-app notification rows and the unread badge.
 *
 * <p>The {@code notify*} methods are called from after-commit listeners, so each
 * runs in its own transaction. Delivery to devices (push) happens elsewhere.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    static final String RELATED_TICKET = "ticket";
    static final String RELATED_EQUIPMENT = "equipment";

    private final NotificationRepository notificationRepository;
    private final AppUserRepository userRepository;
    private final RestaurantRepository restaurantRepository;
    private final ResourceMapper mapper;

    // ==================== TICKET NOTIFICATIONS ====================

    /**
     * Standard creation path: admins and managers are told a ticket is waiting for triage.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int notifyTicketCreated(TicketDTO ticket) {
        String message = String.format("A new ticket \"%s\" has been created for %s",
                ticket.getTitle(), restaurantName(ticket.getRestaurantId()));
        return notifyRoles(EnumSet.of(UserRole.ADMIN, UserRole.MANAGER), "New Ticket Created", message,
                NotificationType.INFO, ticket.getId(), ticket.getCreatedBy());
    }

    /**
     * Helpdesk path: every technician sees the job so one can pick it up.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int notifyFieldTicketAvailable(TicketDTO ticket) {
        String message = String.format("%s at %s - %s priority",
                ticket.getTitle(), restaurantName(ticket.getRestaurantId()),
                ticket.getPriority().getValue().toUpperCase());
        boolean urgent = ticket.getPriority() == TicketPriority.HIGH || ticket.getPriority() == TicketPriority.CRITICAL;
        NotificationType type = urgent ? NotificationType.WARNING : NotificationType.INFO;
        return notifyRoles(EnumSet.of(UserRole.TECHNICIAN, UserRole.SOFTWARE_TECH), "New Field Ticket Available",
                message, type, ticket.getId(), null);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void notifyAssigned(TicketDTO ticket) {
        notifyUser(ticket.getAssignedTo(), "Ticket Assigned",
                String.format("You have been assigned ticket %s: %s", ticket.getTicketNumber(), ticket.getTitle()),
                NotificationType.INFO, ticket.getId(), RELATED_TICKET);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void notifyStatusChanged(TicketDTO ticket) {
        notifyUser(ticket.getAssignedTo(), "Ticket Status Updated",
                "Ticket status changed to " + ticket.getStatus().getValue(),
                NotificationType.INFO, ticket.getId(), RELATED_TICKET);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void notifyResolved(TicketDTO ticket) {
        notifyUser(ticket.getCreatedBy(), "Ticket Resolved",
                String.format("Ticket %s \"%s\" has been resolved", ticket.getTicketNumber(), ticket.getTitle()),
                NotificationType.SUCCESS, ticket.getId(), RELATED_TICKET);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int notifyLowStock(EquipmentItem item) {
        String message = String.format("%s is down to %d (minimum %d)",
                item.getName(), item.getStockLevel(), item.getMinStockLevel());
        List<AppUser> recipients = userRepository.findByRoleIn(EnumSet.of(UserRole.WAREHOUSE, UserRole.MANAGER));
        recipients.forEach(user -> save(user.getId(), "Low Stock Alert", message,
                NotificationType.WARNING, item.getId(), RELATED_EQUIPMENT));
        return recipients.size();
    }

    // ==================== READ / MARK ====================

    @Transactional(readOnly = true)
    public PagedResponse<NotificationDTO> getNotifications(SessionContext session, int page, int size) {
        return PagedResponse.from(
                notificationRepository.findByUserIdOrderByCreatedAtDesc(session.getUserId(), PageRequest.of(page, size)),
                mapper::toDTO);
    }

    @Transactional(readOnly = true)
    public long getUnreadCount(SessionContext session) {
        return notificationRepository.countByUserIdAndReadFalse(session.getUserId());
    }

    @Transactional
    public NotificationDTO markRead(Long id, SessionContext session) {
        Notification notification = notificationRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Notification", id));
        if (!Objects.equals(notification.getUserId(), session.getUserId())) {
            throw new PermissionDeniedException("Notification " + id + " belongs to another user");
        }
        notification.setRead(true);
        return mapper.toDTO(notificationRepository.save(notification));
    }

    @Transactional
    public int markAllRead(SessionContext session) {
        int updated = notificationRepository.markAllRead(session.getUserId());
        log.debug("Marked {} notifications read for user {}", updated, session.getUserId());
        return updated;
    }

    // ==================== HELPERS ====================

    private int notifyRoles(Collection<UserRole> roles, String title, String message, NotificationType type,
                            Long ticketId, Long excludeUserId) {
        List<AppUser> recipients = userRepository.findByRoleIn(roles).stream()
                .filter(user -> !user.getId().equals(excludeUserId))
                .toList();
        recipients.forEach(user -> save(user.getId(), title, message, type, ticketId, RELATED_TICKET));
        log.info("🔔 '{}' sent to {} users with roles {}", title, recipients.size(), roles);
        return recipients.size();
    }

    private void notifyUser(Long userId, String title, String message, NotificationType type,
                            Long relatedId, String relatedType) {
        if (userId == null) {
            log.debug("No recipient for '{}' on {} {}", title, relatedType, relatedId);
            return;
        }
        save(userId, title, message, type, relatedId, relatedType);
        log.info("🔔 '{}' sent to user {}", title, userId);
    }

    private void save(Long userId, String title, String message, NotificationType type,
                      Long relatedId, String relatedType) {
        notificationRepository.save(Notification.builder()
                .userId(userId)
                .title(title)
                .message(message)
                .type(type)
                .relatedId(relatedId)
                .relatedType(relatedType)
                .build());
    }

    private String restaurantName(Long restaurantId) {
        return restaurantRepository.findById(restaurantId)
                .map(r -> r.getName())
                .orElse("restaurant " + restaurantId);
    }
}
