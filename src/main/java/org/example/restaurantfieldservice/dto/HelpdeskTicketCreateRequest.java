package org.example.restaurantfieldservice.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.example.restaurantfieldservice.enums.TicketPriority;

/**
 * Intake form used by the helpdesk when a remote fix failed and a
 * technician has to go on site.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HelpdeskTicketCreateRequest {

    @NotBlank(message = "Title is required")
    @Size(max = 255, message = "Title must not exceed 255 characters")
    private String title;

    @NotNull(message = "Priority is required")
    private TicketPriority priority;

    @NotNull(message = "Device ID is required")
    private Long deviceId;

    @NotNull(message = "Restaurant ID is required")
    private Long restaurantId;

    @Size(max = 50)
    private String jiraTicketId;

    private String customerReport;
    private String problemDescription;
    private String initialDiagnosis;
    private String remoteStepsAttempted;
    private String businessImpact;

    /** critical, high, normal or low. */
    @Size(max = 20)
    private String urgencyLevel;

    private Boolean requiresOnSite;

    @Positive
    private Double estimatedDurationHours;

    @Size(max = 100)
    private String contactPerson;

    @Size(max = 30)
    private String contactPhone;

    private String accessInstructions;
}
