package org.example.restaurantfieldservice.mapper;

import lombok.RequiredArgsConstructor;
import org.example.restaurantfieldservice.dto.HelpdeskTicketCreateRequest;
import org.example.restaurantfieldservice.dto.TicketCommentDTO;
import org.example.restaurantfieldservice.dto.TicketCreateRequest;
import org.example.restaurantfieldservice.dto.TicketDTO;
import org.example.restaurantfieldservice.dto.TicketHistoryDTO;
import org.example.restaurantfieldservice.entity.Ticket;
import org.example.restaurantfieldservice.entity.TicketComment;
import org.example.restaurantfieldservice.entity.TicketHistory;
import org.example.restaurantfieldservice.enums.TicketSource;
import org.example.restaurantfieldservice.enums.TicketStatus;
import org.example.restaurantfieldservice.lifecycle.SlaPolicy;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.StringJoiner;

@Component
@RequiredArgsConstructor
public class TicketMapper {

    private final SlaPolicy slaPolicy;

    public TicketDTO toDTO(Ticket ticket) {
        if (ticket == null) {
            return null;
        }

        return TicketDTO.builder()
                .id(ticket.getId())
                .ticketNumber(ticket.getTicketNumber())
                .title(ticket.getTitle())
                .diagnosticInfo(ticket.getDiagnosticInfo())
                .status(ticket.getStatus())
                .priority(ticket.getPriority())
                .source(ticket.getSource())
                .deviceId(ticket.getDeviceId())
                .restaurantId(ticket.getRestaurantId())
                .assignedTo(ticket.getAssignedTo())
                .createdBy(ticket.getCreatedBy())
                .createdAt(ticket.getCreatedAt())
                .updatedAt(ticket.getUpdatedAt())
                .assignedAt(ticket.getAssignedAt())
                .firstResponseAt(ticket.getFirstResponseAt())
                .resolvedAt(ticket.getResolvedAt())
                .closedAt(ticket.getClosedAt())
                .slaDueAt(ticket.getSlaDueAt())
                .resolution(ticket.getResolution())
                .scheduleNote(ticket.getScheduleNote())
                .urgencyLevel(ticket.getUrgencyLevel())
                .jiraTicketId(ticket.getJiraTicketId())
                .contactPerson(ticket.getContactPerson())
                .contactPhone(ticket.getContactPhone())
                .requiresOnSite(ticket.getRequiresOnSite())
                .estimatedDurationHours(ticket.getEstimatedDurationHours())
                .photos(ticket.getPhotos() != null ? new ArrayList<>(ticket.getPhotos()) : new ArrayList<>())
                .overdue(slaPolicy.isOverdue(ticket.getSlaDueAt(), ticket.getStatus()))
                .build();
    }

    public Ticket toEntity(TicketCreateRequest request) {
        if (request == null) {
            return null;
        }
        return Ticket.builder()
                .ticketNumber(request.getTicketNumber() != null ? request.getTicketNumber().trim() : null)
                .title(request.getTitle().trim())
                .diagnosticInfo(request.getDiagnosticInfo())
                .priority(request.getPriority())
                .status(TicketStatus.NEW)
                .source(TicketSource.STANDARD)
                .deviceId(request.getDeviceId())
                .restaurantId(request.getRestaurantId())
                .photos(request.getPhotos() != null ? new ArrayList<>(request.getPhotos()) : new ArrayList<>())
                .build();
    }

    /**
     * Helpdesk intake fields that have no column of their own are folded into
     * the diagnostic text the technician reads on site.
     */
    public Ticket toEntity(HelpdeskTicketCreateRequest request) {
        if (request == null) {
            return null;
        }
        return Ticket.builder()
                .title(request.getTitle().trim())
                .diagnosticInfo(buildHelpdeskDiagnostic(request))
                .priority(request.getPriority())
                .status(TicketStatus.NEW)
                .source(TicketSource.HELPDESK)
                .deviceId(request.getDeviceId())
                .restaurantId(request.getRestaurantId())
                .urgencyLevel(request.getUrgencyLevel())
                .jiraTicketId(request.getJiraTicketId())
                .contactPerson(request.getContactPerson())
                .contactPhone(request.getContactPhone())
                .requiresOnSite(request.getRequiresOnSite() != null ? request.getRequiresOnSite() : Boolean.TRUE)
                .estimatedDurationHours(request.getEstimatedDurationHours())
                .photos(new ArrayList<>())
                .build();
    }

    public TicketHistoryDTO toDTO(TicketHistory history) {
        return TicketHistoryDTO.builder()
                .id(history.getId())
                .ticketId(history.getTicketId())
                .status(history.getStatus())
                .notes(history.getNotes())
                .userId(history.getUserId())
                .timestamp(history.getTimestamp())
                .build();
    }

    public TicketCommentDTO toDTO(TicketComment comment, String userName) {
        return TicketCommentDTO.builder()
                .id(comment.getId())
                .ticketId(comment.getTicketId())
                .userId(comment.getUserId())
                .userName(userName)
                .body(comment.getBody())
                .createdAt(comment.getCreatedAt())
                .build();
    }

    private String buildHelpdeskDiagnostic(HelpdeskTicketCreateRequest request) {
        StringJoiner joiner = new StringJoiner("\n");
        appendSection(joiner, "Customer report", request.getCustomerReport());
        appendSection(joiner, "Problem description", request.getProblemDescription());
        appendSection(joiner, "Initial diagnosis", request.getInitialDiagnosis());
        appendSection(joiner, "Remote steps attempted", request.getRemoteStepsAttempted());
        appendSection(joiner, "Business impact", request.getBusinessImpact());
        appendSection(joiner, "Access instructions", request.getAccessInstructions());
        return joiner.length() == 0 ? null : joiner.toString();
    }

    private void appendSection(StringJoiner joiner, String label, String value) {
        if (StringUtils.hasText(value)) {
            joiner.add(label + ": " + value.trim());
        }
    }
}
