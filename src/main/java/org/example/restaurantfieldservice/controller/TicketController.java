package org.example.restaurantfieldservice.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.restaurantfieldservice.command.TicketCommandExecutor;
import org.example.restaurantfieldservice.dto.HelpdeskTicketCreateRequest;
import org.example.restaurantfieldservice.dto.InterventionDTO;
import org.example.restaurantfieldservice.dto.InterventionRequest;
import org.example.restaurantfieldservice.dto.PagedResponse;
import org.example.restaurantfieldservice.dto.TicketAssignRequest;
import org.example.restaurantfieldservice.dto.TicketCommentDTO;
import org.example.restaurantfieldservice.dto.TicketCommentRequest;
import org.example.restaurantfieldservice.dto.TicketCreateRequest;
import org.example.restaurantfieldservice.dto.TicketDTO;
import org.example.restaurantfieldservice.dto.TicketDetailDTO;
import org.example.restaurantfieldservice.dto.TicketHistoryDTO;
import org.example.restaurantfieldservice.dto.TicketPhotoRequest;
import org.example.restaurantfieldservice.dto.TicketScheduleRequest;
import org.example.restaurantfieldservice.dto.TicketTransitionRequest;
import org.example.restaurantfieldservice.dto.TicketUpdateRequest;
import org.example.restaurantfieldservice.enums.TicketPriority;
import org.example.restaurantfieldservice.enums.TicketStatus;
import org.example.restaurantfieldservice.service.InterventionService;
import org.example.restaurantfieldservice.service.TicketService;
import org.example.restaurantfieldservice.session.SessionContext;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Set;

/**
 * Ticket endpoints. Status changes go through {@link TicketCommandExecutor} so the
 * cached view is updated optimistically and queued for replay when offline.
 */
@Slf4j
@RestController
@RequestMapping("/api/tickets")
@RequiredArgsConstructor
public class TicketController {

    private final TicketService ticketService;
    private final TicketCommandExecutor commandExecutor;
    private final InterventionService interventionService;

    // ==================== CREATE ====================

    /**
     * POST /api/tickets
     */
    @PostMapping
    public ResponseEntity<TicketDTO> createTicket(@RequestBody TicketCreateRequest request,
                                                  SessionContext session) {
        log.info("POST /api/tickets - Creating ticket");
        return new ResponseEntity<>(ticketService.createTicket(request, session), HttpStatus.CREATED);
    }

    /**
     * POST /api/tickets/helpdesk
     */
    @PostMapping("/helpdesk")
    public ResponseEntity<TicketDTO> createHelpdeskTicket(@RequestBody HelpdeskTicketCreateRequest request,
                                                          SessionContext session) {
        log.info("POST /api/tickets/helpdesk - Creating ticket, JIRA: {}", request.getJiraTicketId());
        return new ResponseEntity<>(ticketService.createHelpdeskTicket(request, session), HttpStatus.CREATED);
    }

    // ==================== READ ====================

    @GetMapping("/{id:\\d+}")
    public ResponseEntity<TicketDTO> getTicketById(@PathVariable Long id, SessionContext session) {
        log.debug("GET /api/tickets/{}", id);
        return ResponseEntity.ok(ticketService.getTicketById(id));
    }

    @GetMapping("/number/{ticketNumber}")
    public ResponseEntity<TicketDTO> getTicketByNumber(@PathVariable String ticketNumber, SessionContext session) {
        log.debug("GET /api/tickets/number/{}", ticketNumber);
        return ResponseEntity.ok(ticketService.getTicketByNumber(ticketNumber));
    }

    /**
     * Ticket with history, comments, intervention and the caller's allowed transitions.
     */
    @GetMapping("/{id:\\d+}/detail")
    public ResponseEntity<TicketDetailDTO> getTicketDetail(@PathVariable Long id, SessionContext session) {
        log.debug("GET /api/tickets/{}/detail", id);
        return ResponseEntity.ok(ticketService.getTicketDetail(id, session));
    }

    /**
     * GET /api/tickets?status=&priority=&restaurantId=&deviceId=&assignedTo=&search=
     */
    @GetMapping
    public ResponseEntity<PagedResponse<TicketDTO>> getTickets(
            @RequestParam(required = false) TicketStatus status,
            @RequestParam(required = false) TicketPriority priority,
            @RequestParam(required = false) Long restaurantId,
            @RequestParam(required = false) Long deviceId,
            @RequestParam(required = false) Long assignedTo,
            @RequestParam(required = false) String search,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size,
            @RequestParam(defaultValue = "createdAt") String sortBy,
            @RequestParam(defaultValue = "desc") String sortDir,
            SessionContext session) {

        log.debug("GET /api/tickets - page: {}, size: {}", page, size);
        return ResponseEntity.ok(ticketService.getTicketsWithFilters(
                status, priority, restaurantId, deviceId, assignedTo, search, page, size, sortBy, sortDir));
    }

    @GetMapping("/{id:\\d+}/history")
    public ResponseEntity<List<TicketHistoryDTO>> getHistory(@PathVariable Long id, SessionContext session) {
        return ResponseEntity.ok(ticketService.getHistory(id));
    }

    @GetMapping("/{id:\\d+}/transitions")
    public ResponseEntity<Set<TicketStatus>> getAllowedTransitions(@PathVariable Long id, SessionContext session) {
        return ResponseEntity.ok(ticketService.getAllowedTransitions(id, session));
    }

    // ==================== UPDATE ====================

    @PutMapping("/{id:\\d+}")
    public ResponseEntity<TicketDTO> updateTicket(@PathVariable Long id,
                                                  @RequestBody TicketUpdateRequest request,
                                                  SessionContext session) {
        log.info("PUT /api/tickets/{}", id);
        return ResponseEntity.ok(ticketService.updateTicket(id, request, session));
    }

    /**
     * POST /api/tickets/{id}/assign
     */
    @PostMapping("/{id:\\d+}/assign")
    public ResponseEntity<TicketDTO> assignTicket(@PathVariable Long id,
                                                  @RequestBody TicketAssignRequest request,
                                                  SessionContext session) {
        log.info("POST /api/tickets/{}/assign - assignee: {}", id, request.getAssigneeId());
        return ResponseEntity.ok(commandExecutor.assign(id, request.getAssigneeId(), request.getNotes(), session));
    }

    /**
     * Technician picks a ticket up from the available tab.
     */
    @PostMapping("/{id:\\d+}/self-assign")
    public ResponseEntity<TicketDTO> selfAssign(@PathVariable Long id, SessionContext session) {
        log.info("POST /api/tickets/{}/self-assign - user: {}", id, session.getUserId());
        return ResponseEntity.ok(commandExecutor.assign(id, session.getUserId(), null, session));
    }

    @PostMapping("/{id:\\d+}/start")
    public ResponseEntity<TicketDTO> startIntervention(@PathVariable Long id, SessionContext session) {
        log.info("POST /api/tickets/{}/start", id);
        return ResponseEntity.ok(commandExecutor.transition(
                id, TicketStatus.IN_PROGRESS, "Intervention started", null, session));
    }

    /**
     * PATCH /api/tickets/{id}/status
     */
    @PatchMapping("/{id:\\d+}/status")
    public ResponseEntity<TicketDTO> transitionTicket(@PathVariable Long id,
                                                      @Valid @RequestBody TicketTransitionRequest request,
                                                      SessionContext session) {
        log.info("PATCH /api/tickets/{}/status - target: {}", id, request.getStatus());
        return ResponseEntity.ok(commandExecutor.transition(
                id, request.getStatus(), request.getNotes(), request.getResolution(), session));
    }

    @PostMapping("/{id:\\d+}/schedule")
    public ResponseEntity<TicketDTO> scheduleTicket(@PathVariable Long id,
                                                    @Valid @RequestBody TicketScheduleRequest request,
                                                    SessionContext session) {
        log.info("POST /api/tickets/{}/schedule - when: {}", id, request.getWhen());
        return ResponseEntity.ok(commandExecutor.schedule(id, request.getWhen(), session));
    }

    // ==================== INTERVENTION ====================

    /**
     * Records the intervention, consumes parts and resolves the ticket.
     * Repeating it on a resolved ticket returns the recorded intervention.
     */
    @PostMapping("/{id:\\d+}/intervention")
    public ResponseEntity<InterventionDTO> completeIntervention(@PathVariable Long id,
                                                                @RequestBody InterventionRequest request,
                                                                SessionContext session) {
        log.info("POST /api/tickets/{}/intervention - {} part lines", id,
                request.getParts() != null ? request.getParts().size() : 0);
        return ResponseEntity.ok(interventionService.completeIntervention(id, request, session));
    }

    @GetMapping("/{id:\\d+}/intervention")
    public ResponseEntity<InterventionDTO> getIntervention(@PathVariable Long id, SessionContext session) {
        return ResponseEntity.ok(interventionService.getIntervention(id));
    }

    // ==================== COMMENTS & PHOTOS ====================

    @GetMapping("/{id:\\d+}/comments")
    public ResponseEntity<List<TicketCommentDTO>> getComments(@PathVariable Long id, SessionContext session) {
        return ResponseEntity.ok(ticketService.getComments(id));
    }

    @PostMapping("/{id:\\d+}/comments")
    public ResponseEntity<TicketCommentDTO> addComment(@PathVariable Long id,
                                                       @Valid @RequestBody TicketCommentRequest request,
                                                       SessionContext session) {
        log.info("POST /api/tickets/{}/comments", id);
        return new ResponseEntity<>(ticketService.addComment(id, request.getBody(), session), HttpStatus.CREATED);
    }

    @PostMapping("/{id:\\d+}/photos")
    public ResponseEntity<TicketDTO> addPhoto(@PathVariable Long id,
                                              @Valid @RequestBody TicketPhotoRequest request,
                                              SessionContext session) {
        log.info("POST /api/tickets/{}/photos", id);
        return ResponseEntity.ok(ticketService.addPhoto(id, request.getUrl(), session));
    }
}
