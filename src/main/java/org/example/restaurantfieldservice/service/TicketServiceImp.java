package org.example.restaurantfieldservice.service;

import jakarta.persistence.criteria.Predicate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.restaurantfieldservice.dto.HelpdeskTicketCreateRequest;
import org.example.restaurantfieldservice.dto.InterventionDTO;
import org.example.restaurantfieldservice.dto.PagedResponse;
import org.example.restaurantfieldservice.dto.TicketCommentDTO;
import org.example.restaurantfieldservice.dto.TicketCreateRequest;
import org.example.restaurantfieldservice.dto.TicketDTO;
import org.example.restaurantfieldservice.dto.TicketDetailDTO;
import org.example.restaurantfieldservice.dto.TicketHistoryDTO;
import org.example.restaurantfieldservice.dto.TicketUpdateRequest;
import org.example.restaurantfieldservice.entity.AppUser;
import org.example.restaurantfieldservice.entity.Device;
import org.example.restaurantfieldservice.entity.Ticket;
import org.example.restaurantfieldservice.entity.TicketComment;
import org.example.restaurantfieldservice.entity.TicketHistory;
import org.example.restaurantfieldservice.enums.ChangeOperation;
import org.example.restaurantfieldservice.enums.DeviceStatus;
import org.example.restaurantfieldservice.enums.TicketPriority;
import org.example.restaurantfieldservice.enums.TicketStatus;
import org.example.restaurantfieldservice.event.EntityChangeEvent;
import org.example.restaurantfieldservice.event.TicketCacheEvent;
import org.example.restaurantfieldservice.event.TicketCreatedEvent;
import org.example.restaurantfieldservice.event.TicketStatusChangedEvent;
import org.example.restaurantfieldservice.event.TicketUpdatedEvent;
import org.example.restaurantfieldservice.exception.InvalidTicketOperationException;
import org.example.restaurantfieldservice.exception.NullRequestException;
import org.example.restaurantfieldservice.exception.ResourceNotFoundException;
import org.example.restaurantfieldservice.exception.TicketNotAssignedException;
import org.example.restaurantfieldservice.lifecycle.SlaPolicy;
import org.example.restaurantfieldservice.lifecycle.TicketAuthorizationPolicy;
import org.example.restaurantfieldservice.lifecycle.TicketLifecycle;
import org.example.restaurantfieldservice.mapper.ResourceMapper;
import org.example.restaurantfieldservice.mapper.TicketMapper;
import org.example.restaurantfieldservice.repository.AppUserRepository;
import org.example.restaurantfieldservice.repository.DeviceRepository;
import org.example.restaurantfieldservice.repository.InterventionRepository;
import org.example.restaurantfieldservice.repository.InventoryUsageRepository;
import org.example.restaurantfieldservice.repository.RestaurantRepository;
import org.example.restaurantfieldservice.repository.TicketCommentRepository;
import org.example.restaurantfieldservice.repository.TicketHistoryRepository;
import org.example.restaurantfieldservice.repository.TicketRepository;
import org.example.restaurantfieldservice.session.SessionContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Implementation of {@link TicketService}.
 *
 * <h3>Transaction Flow:</h3>
 * <pre>
 * 1. Validate the request and load the ticket
 * 2. Lifecycle check, then authorization check
 * 3. Apply the change and append one history row
 * 4. Publish domain events inside the transaction
 * 5. After commit, TicketEventListener refreshes the cache, notifies and streams the change
 * </pre>
 */
@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class TicketServiceImp implements TicketService {

    static final String TICKETS_TABLE = "tickets";
    static final String HISTORY_TABLE = "ticket_history";
    static final String COMMENTS_TABLE = "ticket_comments";

    private static final DateTimeFormatter TICKET_NUMBER_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final Set<String> SORTABLE_FIELDS =
            Set.of("createdAt", "updatedAt", "slaDueAt", "priority", "status", "ticketNumber", "title");

    private final TicketRepository ticketRepository;
    private final TicketHistoryRepository historyRepository;
    private final TicketCommentRepository commentRepository;
    private final DeviceRepository deviceRepository;
    private final RestaurantRepository restaurantRepository;
    private final AppUserRepository userRepository;
    private final InterventionRepository interventionRepository;
    private final InventoryUsageRepository usageRepository;
    private final TicketMapper ticketMapper;
    private final ResourceMapper resourceMapper;
    private final TicketValidationService validationService;
    private final TicketCacheService cacheService;
    private final TicketLifecycle lifecycle;
    private final SlaPolicy slaPolicy;
    private final TicketAuthorizationPolicy authorizationPolicy;
    private final ApplicationEventPublisher eventPublisher;

    // ==================== CREATE ====================

    @Override
    public TicketDTO createTicket(TicketCreateRequest request, SessionContext session) {
        validationService.validateCreateRequest(request);

        Ticket ticket = ticketMapper.toEntity(request);
        if (!StringUtils.hasText(ticket.getTicketNumber())) {
            ticket.setTicketNumber(generateTicketNumber());
        }
        ticket.setCreatedBy(session.getUserId());
        ticket.setCreatedAt(slaPolicy.now());
        ticket.setSlaDueAt(slaPolicy.standardDueDate(request.getPriority()));

        log.info("📝 Creating ticket {} ({} priority, SLA due {})",
                ticket.getTicketNumber(), ticket.getPriority().getValue(), ticket.getSlaDueAt());
        return persistNewTicket(ticket, "Ticket created", session);
    }

    @Override
    public TicketDTO createHelpdeskTicket(HelpdeskTicketCreateRequest request, SessionContext session) {
        validationService.validateHelpdeskRequest(request);

        Ticket ticket = ticketMapper.toEntity(request);
        ticket.setTicketNumber(generateTicketNumber());
        ticket.setCreatedBy(session.getUserId());
        ticket.setCreatedAt(slaPolicy.now());
        ticket.setSlaDueAt(slaPolicy.helpdeskDueDate(request.getPriority(), request.getUrgencyLevel()));

        String note = StringUtils.hasText(request.getJiraTicketId())
                ? "Ticket created by helpdesk. JIRA: " + request.getJiraTicketId()
                : "Ticket created by helpdesk";
        log.info("📞 Creating helpdesk ticket {} (urgency {}, SLA due {})",
                ticket.getTicketNumber(), request.getUrgencyLevel(), ticket.getSlaDueAt());
        return persistNewTicket(ticket, note, session);
    }

    private TicketDTO persistNewTicket(Ticket ticket, String historyNote, SessionContext session) {
        Ticket saved = ticketRepository.save(ticket);

        Device device = deviceRepository.findById(saved.getDeviceId())
                .orElseThrow(() -> new ResourceNotFoundException("Device", saved.getDeviceId()));
        if (device.getStatus() != DeviceStatus.MAINTENANCE) {
            device.setStatus(DeviceStatus.MAINTENANCE);
            deviceRepository.save(device);
            eventPublisher.publishEvent(new EntityChangeEvent(this, "devices", device.getId(), ChangeOperation.UPDATE));
        }

        recordHistory(saved, historyNote, session.getUserId());

        TicketDTO ticketDTO = ticketMapper.toDTO(saved);
        eventPublisher.publishEvent(new TicketCreatedEvent(this, ticketDTO));
        eventPublisher.publishEvent(new EntityChangeEvent(this, TICKETS_TABLE, saved.getId(), ChangeOperation.INSERT));

        log.info("✅ Ticket created - id: {}, ticketNumber: {} (cache update pending commit)",
                saved.getId(), saved.getTicketNumber());
        return ticketDTO;
    }

    // ==================== READ ====================

    @Override
    @Transactional(readOnly = true)
    public TicketDTO getTicketById(Long id) {
        validationService.validateId(id, "Ticket ID");

        var cached = cacheService.getTicketById(id);
        if (cached.isPresent()) {
            return cached.get();
        }

        TicketDTO ticketDTO = ticketMapper.toDTO(findTicket(id));
        eventPublisher.publishEvent(new TicketCacheEvent(this, ticketDTO));
        return ticketDTO;
    }

    @Override
    @Transactional(readOnly = true)
    public TicketDTO getTicketByNumber(String ticketNumber) {
        if (!StringUtils.hasText(ticketNumber)) {
            throw new NullRequestException("ticketNumber", "Ticket number cannot be null or empty");
        }
        String trimmedNumber = ticketNumber.trim();

        var cached = cacheService.getTicketByNumber(trimmedNumber);
        if (cached.isPresent()) {
            return cached.get();
        }

        Ticket ticket = ticketRepository.findByTicketNumber(trimmedNumber)
                .orElseThrow(() -> new ResourceNotFoundException("Ticket", "ticketNumber", trimmedNumber));
        TicketDTO ticketDTO = ticketMapper.toDTO(ticket);
        eventPublisher.publishEvent(new TicketCacheEvent(this, ticketDTO));
        return ticketDTO;
    }

    @Override
    @Transactional(readOnly = true)
    public TicketDetailDTO getTicketDetail(Long id, SessionContext session) {
        validationService.validateId(id, "Ticket ID");
        Ticket ticket = findTicket(id);

        InterventionDTO intervention = interventionRepository.findFirstByTicketIdOrderByCompletedAtDesc(id)
                .map(i -> resourceMapper.toDTO(i, usageRepository.findByInterventionId(i.getId())))
                .orElse(null);

        return TicketDetailDTO.builder()
                .ticket(ticketMapper.toDTO(ticket))
                .device(deviceRepository.findById(ticket.getDeviceId()).map(resourceMapper::toDTO).orElse(null))
                .restaurant(restaurantRepository.findById(ticket.getRestaurantId())
                        .map(resourceMapper::toDTO).orElse(null))
                .assignee(ticket.getAssignedTo() != null
                        ? userRepository.findById(ticket.getAssignedTo()).map(resourceMapper::toDTO).orElse(null)
                        : null)
                .history(getHistory(id))
                .comments(getComments(id))
                .intervention(intervention)
                .allowedTransitions(authorizationPolicy.allowedTargets(session, ticket))
                .build();
    }

    @Override
    @Transactional(readOnly = true)
    public PagedResponse<TicketDTO> getTicketsWithFilters(
            TicketStatus status, TicketPriority priority, Long restaurantId, Long deviceId, Long assignedTo,
            String search, int page, int size, String sortBy, String sortDir) {

        String safeSortBy = StringUtils.hasText(sortBy) && SORTABLE_FIELDS.contains(sortBy) ? sortBy : "createdAt";
        String safeSortDir = StringUtils.hasText(sortDir) ? sortDir : "desc";

        Sort sort = safeSortDir.equalsIgnoreCase("asc")
                ? Sort.by(safeSortBy).ascending()
                : Sort.by(safeSortBy).descending();

        Pageable pageable = PageRequest.of(page, size, sort);
        Specification<Ticket> spec = buildFilterSpecification(status, priority, restaurantId, deviceId, assignedTo, search);

        Page<Ticket> ticketPage = ticketRepository.findAll(spec, pageable);
        return PagedResponse.from(ticketPage, ticketMapper::toDTO);
    }

    @Override
    @Transactional(readOnly = true)
    public List<TicketHistoryDTO> getHistory(Long id) {
        validationService.validateId(id, "Ticket ID");
        return historyRepository.findByTicketIdOrderByTimestampAsc(id).stream()
                .map(ticketMapper::toDTO)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<TicketCommentDTO> getComments(Long id) {
        validationService.validateId(id, "Ticket ID");
        List<TicketComment> comments = commentRepository.findByTicketIdOrderByCreatedAtAsc(id);
        if (comments.isEmpty()) {
            return List.of();
        }

        Set<Long> authorIds = comments.stream().map(TicketComment::getUserId).collect(Collectors.toSet());
        Map<Long, String> names = userRepository.findAllById(authorIds).stream()
                .collect(Collectors.toMap(AppUser::getId, AppUser::getName));
        return comments.stream()
                .map(c -> ticketMapper.toDTO(c, names.getOrDefault(c.getUserId(), "Unknown")))
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Set<TicketStatus> getAllowedTransitions(Long id, SessionContext session) {
        validationService.validateId(id, "Ticket ID");
        return authorizationPolicy.allowedTargets(session, findTicket(id));
    }

    // ==================== UPDATE ====================

    @Override
    public TicketDTO updateTicket(Long id, TicketUpdateRequest request, SessionContext session) {
        validationService.validateUpdateRequest(id, request);
        Ticket ticket = findTicket(id);

        if (ticket.getStatus() == TicketStatus.CLOSED) {
            throw new InvalidTicketOperationException("update", "Closed tickets cannot be edited");
        }

        if (StringUtils.hasText(request.getTitle())) {
            ticket.setTitle(request.getTitle().trim());
        }
        if (request.getDiagnosticInfo() != null) {
            ticket.setDiagnosticInfo(request.getDiagnosticInfo().trim());
        }
        // SLA stays as computed at creation
        if (request.getPriority() != null) {
            ticket.setPriority(request.getPriority());
        }

        return saveAndPublishUpdate(ticket);
    }

    @Override
    public TicketDTO assignTicket(Long id, Long assigneeId, String notes, SessionContext session) {
        validationService.validateId(id, "Ticket ID");
        Ticket ticket = findTicket(id);
        if (assigneeId == null) {
            throw new TicketNotAssignedException(id);
        }
        AppUser assignee = userRepository.findById(assigneeId)
                .orElseThrow(() -> new ResourceNotFoundException("User", assigneeId));

        TicketStatus previousStatus = ticket.getStatus();
        Long previousAssignee = ticket.getAssignedTo();

        if (previousStatus == TicketStatus.ASSIGNED) {
            if (assigneeId.equals(previousAssignee)) {
                log.debug("Ticket {} already assigned to {}", id, assigneeId);
                return ticketMapper.toDTO(ticket);
            }
        } else if (!lifecycle.isAllowed(previousStatus, TicketStatus.ASSIGNED)) {
            throw new InvalidTicketOperationException("assign",
                    String.format("Ticket in status '%s' cannot be assigned", previousStatus.getValue()));
        }
        authorizationPolicy.requireTransition(session, ticket, TicketStatus.ASSIGNED, assigneeId);

        ticket.setAssignedTo(assigneeId);
        ticket.setStatus(TicketStatus.ASSIGNED);
        ticket.setAssignedAt(slaPolicy.now());

        String note;
        if (StringUtils.hasText(notes)) {
            note = notes.trim();
        } else if (assigneeId.equals(session.getUserId())) {
            note = "Ticket self-assigned by technician";
        } else {
            note = "Ticket assigned to " + assignee.getName();
        }

        log.info("👷 Ticket {} assigned to {} by {}", ticket.getTicketNumber(), assigneeId, session.getUserId());
        return saveTransition(ticket, previousStatus, previousAssignee, note, session);
    }

    @Override
    public TicketDTO transitionTicket(Long id, TicketStatus target, String notes, String resolution,
                                      SessionContext session) {
        validationService.validateId(id, "Ticket ID");
        Ticket ticket = findTicket(id);

        if (!lifecycle.validateTransition(ticket, target, resolution)) {
            return ticketMapper.toDTO(ticket);
        }
        authorizationPolicy.requireTransition(session, ticket, target, ticket.getAssignedTo());

        TicketStatus previousStatus = ticket.getStatus();
        LocalDateTime now = slaPolicy.now();
        ticket.setStatus(target);
        switch (target) {
            case ASSIGNED -> ticket.setAssignedAt(now);
            case IN_PROGRESS -> {
                if (ticket.getFirstResponseAt() == null) {
                    ticket.setFirstResponseAt(now);
                }
            }
            case SCHEDULED -> {
                if (StringUtils.hasText(notes)) {
                    ticket.setScheduleNote(notes.trim());
                }
            }
            case RESOLVED -> {
                ticket.setResolvedAt(now);
                ticket.setResolution(resolution.trim());
            }
            case CLOSED -> ticket.setClosedAt(now);
            default -> {
            }
        }

        String note = StringUtils.hasText(notes) ? notes.trim() : "Status changed to " + target.getValue();
        log.info("🔄 Ticket {} {} -> {} by {}",
                ticket.getTicketNumber(), previousStatus.getValue(), target.getValue(), session.getUserId());
        return saveTransition(ticket, previousStatus, ticket.getAssignedTo(), note, session);
    }

    @Override
    public TicketDTO scheduleTicket(Long id, String when, SessionContext session) {
        if (!StringUtils.hasText(when)) {
            throw new NullRequestException("when", "A schedule is required");
        }
        return transitionTicket(id, TicketStatus.SCHEDULED, "Scheduled for " + when.trim(), null, session);
    }

    @Override
    public TicketCommentDTO addComment(Long id, String body, SessionContext session) {
        validationService.validateId(id, "Ticket ID");
        if (!StringUtils.hasText(body)) {
            throw new IllegalArgumentException("Comment body is required");
        }
        Ticket ticket = findTicket(id);

        TicketComment comment = commentRepository.save(TicketComment.builder()
                .ticketId(ticket.getId())
                .userId(session.getUserId())
                .body(body.trim())
                .createdAt(slaPolicy.now())
                .build());
        eventPublisher.publishEvent(new EntityChangeEvent(this, COMMENTS_TABLE, comment.getId(), ChangeOperation.INSERT));

        log.debug("Comment {} added to ticket {}", comment.getId(), id);
        return ticketMapper.toDTO(comment, session.getName());
    }

    @Override
    public TicketDTO addPhoto(Long id, String url, SessionContext session) {
        validationService.validateId(id, "Ticket ID");
        if (!StringUtils.hasText(url)) {
            throw new IllegalArgumentException("Photo URL is required");
        }
        Ticket ticket = findTicket(id);
        if (ticket.getPhotos() == null) {
            ticket.setPhotos(new ArrayList<>());
        }
        ticket.getPhotos().add(url.trim());

        log.info("📷 Photo attached to ticket {} by {}", ticket.getTicketNumber(), session.getUserId());
        return saveAndPublishUpdate(ticket);
    }

    // ==================== CACHE ====================

    @Override
    @Transactional(readOnly = true)
    public TicketDTO refreshCachedView(Long id) {
        Ticket ticket = ticketRepository.findById(id).orElse(null);
        if (ticket == null) {
            cacheService.evictTicket(id, null);
            throw new ResourceNotFoundException("Ticket", id);
        }
        TicketDTO fresh = ticketMapper.toDTO(ticket);
        cacheService.evictTicket(id, ticket.getTicketNumber());
        cacheService.cacheTicket(fresh);
        return fresh;
    }

    // ==================== HELPERS ====================

    private Ticket findTicket(Long id) {
        return ticketRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Ticket", id));
    }

    private TicketDTO saveTransition(Ticket ticket, TicketStatus previousStatus, Long previousAssignee,
                                     String note, SessionContext session) {
        Ticket saved = ticketRepository.save(ticket);
        recordHistory(saved, note, session.getUserId());

        TicketDTO ticketDTO = ticketMapper.toDTO(saved);
        eventPublisher.publishEvent(new TicketStatusChangedEvent(
                this, ticketDTO, previousStatus, previousAssignee, session.getUserId()));
        eventPublisher.publishEvent(new EntityChangeEvent(this, TICKETS_TABLE, saved.getId(), ChangeOperation.UPDATE));
        return ticketDTO;
    }

    private TicketDTO saveAndPublishUpdate(Ticket ticket) {
        Ticket saved = ticketRepository.save(ticket);
        TicketDTO ticketDTO = ticketMapper.toDTO(saved);
        eventPublisher.publishEvent(new TicketUpdatedEvent(this, ticketDTO));
        eventPublisher.publishEvent(new EntityChangeEvent(this, TICKETS_TABLE, saved.getId(), ChangeOperation.UPDATE));
        log.info("✅ Ticket updated - id: {} (cache refresh pending commit)", saved.getId());
        return ticketDTO;
    }

    private void recordHistory(Ticket ticket, String notes, Long userId) {
        TicketHistory history = historyRepository.save(TicketHistory.builder()
                .ticketId(ticket.getId())
                .status(ticket.getStatus())
                .notes(notes)
                .userId(userId)
                .timestamp(slaPolicy.now())
                .build());
        eventPublisher.publishEvent(new EntityChangeEvent(this, HISTORY_TABLE, history.getId(), ChangeOperation.INSERT));
    }

    private String generateTicketNumber() {
        String number;
        do {
            number = "TKT-" + slaPolicy.now().format(TICKET_NUMBER_DATE) + "-"
                    + UUID.randomUUID().toString().substring(0, 6).toUpperCase();
        } while (ticketRepository.existsByTicketNumber(number));
        return number;
    }

    private Specification<Ticket> buildFilterSpecification(
            TicketStatus status, TicketPriority priority, Long restaurantId, Long deviceId, Long assignedTo,
            String search) {

        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();

            if (status != null) {
                predicates.add(cb.equal(root.get("status"), status));
            }
            if (priority != null) {
                predicates.add(cb.equal(root.get("priority"), priority));
            }
            if (restaurantId != null && restaurantId > 0) {
                predicates.add(cb.equal(root.get("restaurantId"), restaurantId));
            }
            if (deviceId != null && deviceId > 0) {
                predicates.add(cb.equal(root.get("deviceId"), deviceId));
            }
            if (assignedTo != null && assignedTo > 0) {
                predicates.add(cb.equal(root.get("assignedTo"), assignedTo));
            }
            if (StringUtils.hasText(search)) {
                String pattern = "%" + search.trim().toLowerCase() + "%";
                predicates.add(cb.or(
                        cb.like(cb.lower(root.get("title")), pattern),
                        cb.like(cb.lower(root.get("ticketNumber")), pattern)));
            }

            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
