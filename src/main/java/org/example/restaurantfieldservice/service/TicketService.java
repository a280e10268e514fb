package org.example.restaurantfieldservice.service;

import org.example.restaurantfieldservice.dto.HelpdeskTicketCreateRequest;
import org.example.restaurantfieldservice.dto.PagedResponse;
import org.example.restaurantfieldservice.dto.TicketCommentDTO;
import org.example.restaurantfieldservice.dto.TicketCreateRequest;
import org.example.restaurantfieldservice.dto.TicketDTO;
import org.example.restaurantfieldservice.dto.TicketDetailDTO;
import org.example.restaurantfieldservice.dto.TicketHistoryDTO;
import org.example.restaurantfieldservice.dto.TicketUpdateRequest;
import org.example.restaurantfieldservice.enums.TicketPriority;
import org.example.restaurantfieldservice.enums.TicketStatus;
import org.example.restaurantfieldservice.session.SessionContext;

import java.util.List;
import java.util.Set;

/**
 * Service interface for ticket operations.
 *
 * <p>Every mutation takes the caller's {@link SessionContext}. Status changes go
 * through the lifecycle check first and the authorization policy second, so an
 * unassigned ticket reports "not assigned" before it reports "permission denied".</p>
 */
public interface TicketService {

    // ==================== CREATE ====================

    /**
     * Open a ticket through the standard path (SLA from the standard table).
     *
     * @throws org.example.restaurantfieldservice.exception.DuplicateResourceException if the ticket number exists
     * @throws org.example.restaurantfieldservice.exception.ResourceNotFoundException if device or restaurant is missing
     */
    TicketDTO createTicket(TicketCreateRequest request, SessionContext session);

    /**
     * Open a ticket from a helpdesk call (SLA from the helpdesk table, all technicians notified).
     */
    TicketDTO createHelpdeskTicket(HelpdeskTicketCreateRequest request, SessionContext session);

    // ==================== READ ====================

    TicketDTO getTicketById(Long id);

    TicketDTO getTicketByNumber(String ticketNumber);

    TicketDetailDTO getTicketDetail(Long id, SessionContext session);

    PagedResponse<TicketDTO> getTicketsWithFilters(
            TicketStatus status, TicketPriority priority, Long restaurantId, Long deviceId, Long assignedTo,
            String search, int page, int size, String sortBy, String sortDir);

    List<TicketHistoryDTO> getHistory(Long id);

    List<TicketCommentDTO> getComments(Long id);

    /**
     * Targets the caller may request for this ticket right now.
     */
    Set<TicketStatus> getAllowedTransitions(Long id, SessionContext session);

    // ==================== UPDATE ====================

    TicketDTO updateTicket(Long id, TicketUpdateRequest request, SessionContext session);

    /**
     * Assign a new ticket, or hand an assigned one over to someone else.
     *
     * @throws org.example.restaurantfieldservice.exception.TicketNotAssignedException if {@code assigneeId} is null
     * @throws org.example.restaurantfieldservice.exception.PermissionDeniedException if a non-admin assigns someone else
     */
    TicketDTO assignTicket(Long id, Long assigneeId, String notes, SessionContext session);

    /**
     * Move a ticket one step forward. Requesting the current status is a no-op.
     *
     * @param resolution required when {@code target} is resolved
     */
    TicketDTO transitionTicket(Long id, TicketStatus target, String notes, String resolution, SessionContext session);

    TicketDTO scheduleTicket(Long id, String when, SessionContext session);

    TicketCommentDTO addComment(Long id, String body, SessionContext session);

    TicketDTO addPhoto(Long id, String url, SessionContext session);

    // ==================== CACHE ====================

    /**
     * Replace the cached view with the committed row.
     */
    TicketDTO refreshCachedView(Long id);
}
