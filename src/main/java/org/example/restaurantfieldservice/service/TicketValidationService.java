package org.example.restaurantfieldservice.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.restaurantfieldservice.dto.HelpdeskTicketCreateRequest;
import org.example.restaurantfieldservice.dto.InterventionRequest;
import org.example.restaurantfieldservice.dto.TicketCreateRequest;
import org.example.restaurantfieldservice.dto.TicketUpdateRequest;
import org.example.restaurantfieldservice.entity.Device;
import org.example.restaurantfieldservice.exception.DuplicateResourceException;
import org.example.restaurantfieldservice.exception.NullRequestException;
import org.example.restaurantfieldservice.exception.ResourceNotFoundException;
import org.example.restaurantfieldservice.repository.DeviceRepository;
import org.example.restaurantfieldservice.repository.RestaurantRepository;
import org.example.restaurantfieldservice.repository.TicketRepository;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Request validation for ticket operations. Field errors are collected and
 * reported together as one {@link IllegalArgumentException}; missing
 * references surface as {@link ResourceNotFoundException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TicketValidationService {

    private static final int MAX_TITLE_LENGTH = 255;
    private static final int MAX_DIAGNOSTIC_LENGTH = 5000;
    private static final Set<String> VALID_URGENCY_LEVELS = Set.of("critical", "high", "normal", "low");

    private final TicketRepository ticketRepository;
    private final DeviceRepository deviceRepository;
    private final RestaurantRepository restaurantRepository;

    // ==================== CREATE VALIDATION ====================

    public void validateCreateRequest(TicketCreateRequest request) {
        if (request == null) {
            throw new NullRequestException("request", "Ticket create request cannot be null");
        }

        List<String> errors = new ArrayList<>();
        validateTitle(request.getTitle(), errors);
        if (request.getPriority() == null) {
            errors.add("Priority is required");
        }
        if (request.getDiagnosticInfo() != null && request.getDiagnosticInfo().length() > MAX_DIAGNOSTIC_LENGTH) {
            errors.add("Diagnostic info must not exceed " + MAX_DIAGNOSTIC_LENGTH + " characters");
        }
        validateDeviceAndRestaurantPresent(request.getDeviceId(), request.getRestaurantId(), errors);
        throwIfErrors(errors);

        if (StringUtils.hasText(request.getTicketNumber())
                && ticketRepository.existsByTicketNumber(request.getTicketNumber().trim())) {
            throw new DuplicateResourceException("Ticket", "ticketNumber", request.getTicketNumber().trim());
        }
        validateDeviceAtRestaurant(request.getDeviceId(), request.getRestaurantId());
    }

    public void validateHelpdeskRequest(HelpdeskTicketCreateRequest request) {
        if (request == null) {
            throw new NullRequestException("request", "Helpdesk ticket request cannot be null");
        }

        List<String> errors = new ArrayList<>();
        validateTitle(request.getTitle(), errors);
        if (request.getPriority() == null) {
            errors.add("Priority is required");
        }
        if (StringUtils.hasText(request.getUrgencyLevel())
                && !VALID_URGENCY_LEVELS.contains(request.getUrgencyLevel().trim().toLowerCase())) {
            errors.add("Invalid urgency level: " + request.getUrgencyLevel() + ". Valid values: " + VALID_URGENCY_LEVELS);
        }
        validateDeviceAndRestaurantPresent(request.getDeviceId(), request.getRestaurantId(), errors);
        throwIfErrors(errors);

        validateDeviceAtRestaurant(request.getDeviceId(), request.getRestaurantId());
    }

    // ==================== UPDATE VALIDATION ====================

    public void validateUpdateRequest(Long id, TicketUpdateRequest request) {
        validateId(id, "Ticket ID");
        if (request == null) {
            throw new NullRequestException("request", "Ticket update request cannot be null");
        }

        List<String> errors = new ArrayList<>();
        if (request.getTitle() != null) {
            if (!StringUtils.hasText(request.getTitle())) {
                errors.add("Title cannot be blank if provided");
            } else if (request.getTitle().trim().length() > MAX_TITLE_LENGTH) {
                errors.add("Title must not exceed " + MAX_TITLE_LENGTH + " characters");
            }
        }
        if (request.getDiagnosticInfo() != null && request.getDiagnosticInfo().length() > MAX_DIAGNOSTIC_LENGTH) {
            errors.add("Diagnostic info must not exceed " + MAX_DIAGNOSTIC_LENGTH + " characters");
        }
        throwIfErrors(errors);
    }

    // ==================== INTERVENTION VALIDATION ====================

    public void validateInterventionRequest(Long ticketId, InterventionRequest request) {
        validateId(ticketId, "Ticket ID");
        if (request == null) {
            throw new NullRequestException("request", "Intervention request cannot be null");
        }

        List<String> errors = new ArrayList<>();
        if (!StringUtils.hasText(request.getWorkPerformed()) || !StringUtils.hasText(request.getResolution())) {
            errors.add("Work performed and resolution are required");
        }
        if (request.getParts() != null) {
            for (InterventionRequest.PartUsage part : request.getParts()) {
                if (part == null || part.getEquipmentId() == null) {
                    errors.add("Each part line needs an equipment ID");
                } else if (part.getQuantity() == null || part.getQuantity() <= 0) {
                    errors.add("Quantity for equipment " + part.getEquipmentId() + " must be positive");
                }
            }
        }
        throwIfErrors(errors);
    }

    // ==================== ID VALIDATION ====================

    public void validateId(Long id, String fieldName) {
        if (id == null) {
            throw new NullRequestException(fieldName, fieldName + " cannot be null");
        }
        if (id <= 0) {
            throw new IllegalArgumentException(fieldName + " must be a positive number");
        }
    }

    // ==================== HELPERS ====================

    private void validateTitle(String title, List<String> errors) {
        if (!StringUtils.hasText(title)) {
            errors.add("Title is required");
        } else if (title.trim().length() > MAX_TITLE_LENGTH) {
            errors.add("Title must not exceed " + MAX_TITLE_LENGTH + " characters");
        }
    }

    private void validateDeviceAndRestaurantPresent(Long deviceId, Long restaurantId, List<String> errors) {
        if (deviceId == null || restaurantId == null) {
            errors.add("Both a device and a restaurant must be selected");
        }
    }

    private void validateDeviceAtRestaurant(Long deviceId, Long restaurantId) {
        if (!restaurantRepository.existsById(restaurantId)) {
            throw new ResourceNotFoundException("Restaurant", restaurantId);
        }
        Device device = deviceRepository.findById(deviceId)
                .orElseThrow(() -> new ResourceNotFoundException("Device", deviceId));
        if (!restaurantId.equals(device.getRestaurantId())) {
            throw new IllegalArgumentException(
                    "Device " + deviceId + " is not installed at restaurant " + restaurantId);
        }
    }

    private void throwIfErrors(List<String> errors) {
        if (!errors.isEmpty()) {
            String errorMessage = String.join("; ", errors);
            log.warn("Validation failed: {}", errorMessage);
            throw new IllegalArgumentException(errorMessage);
        }
    }
}
