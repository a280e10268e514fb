package org.example.restaurantfieldservice.mapper;

import org.example.restaurantfieldservice.dto.*;
import org.example.restaurantfieldservice.entity.*;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * Entity to DTO conversion for the non-ticket resources.
 */
@Component
public class ResourceMapper {

    public DeviceDTO toDTO(Device device) {
        if (device == null) {
            return null;
        }
        return DeviceDTO.builder()
                .id(device.getId())
                .name(device.getName())
                .type(device.getType())
                .serialNumber(device.getSerialNumber())
                .model(device.getModel())
                .status(device.getStatus())
                .restaurantId(device.getRestaurantId())
                .installationDate(device.getInstallationDate())
                .lastMaintenanceAt(device.getLastMaintenanceAt())
                .build();
    }

    public RestaurantDTO toDTO(Restaurant restaurant) {
        if (restaurant == null) {
            return null;
        }
        return RestaurantDTO.builder()
                .id(restaurant.getId())
                .name(restaurant.getName())
                .address(restaurant.getAddress())
                .city(restaurant.getCity())
                .phone(restaurant.getPhone())
                .managerId(restaurant.getManagerId())
                .build();
    }

    public EquipmentItemDTO toDTO(EquipmentItem item) {
        if (item == null) {
            return null;
        }
        boolean lowStock = item.getMinStockLevel() != null && item.getStockLevel() <= item.getMinStockLevel();
        return EquipmentItemDTO.builder()
                .id(item.getId())
                .name(item.getName())
                .type(item.getType())
                .stockLevel(item.getStockLevel())
                .minStockLevel(item.getMinStockLevel())
                .maxStockLevel(item.getMaxStockLevel())
                .warehouseLocation(item.getWarehouseLocation())
                .supplier(item.getSupplier())
                .unitCost(item.getUnitCost())
                .lowStock(lowStock)
                .build();
    }

    public UserDTO toDTO(AppUser user) {
        if (user == null) {
            return null;
        }
        return UserDTO.builder()
                .id(user.getId())
                .name(user.getName())
                .email(user.getEmail())
                .role(user.getRole())
                .phone(user.getPhone())
                .specialization(user.getSpecialization())
                .avatarUrl(user.getAvatarUrl())
                .build();
    }

    public NotificationDTO toDTO(Notification notification) {
        return NotificationDTO.builder()
                .id(notification.getId())
                .title(notification.getTitle())
                .message(notification.getMessage())
                .type(notification.getType())
                .relatedId(notification.getRelatedId())
                .relatedType(notification.getRelatedType())
                .read(notification.isRead())
                .createdAt(notification.getCreatedAt())
                .build();
    }

    public KnowledgeArticleDTO toDTO(KnowledgeArticle article) {
        return KnowledgeArticleDTO.builder()
                .id(article.getId())
                .title(article.getTitle())
                .summary(article.getSummary())
                .content(article.getContent())
                .tags(new LinkedHashSet<>(article.getTags()))
                .authorId(article.getAuthorId())
                .imageUrl(article.getImageUrl())
                .viewCount(article.getViewCount())
                .createdAt(article.getCreatedAt())
                .updatedAt(article.getUpdatedAt())
                .build();
    }

    public MaintenanceRecordDTO toDTO(MaintenanceRecord maintenanceRecord) {
        return MaintenanceRecordDTO.builder()
                .id(maintenanceRecord.getId())
                .deviceId(maintenanceRecord.getDeviceId())
                .maintenanceType(maintenanceRecord.getMaintenanceType())
                .description(maintenanceRecord.getDescription())
                .status(maintenanceRecord.getStatus())
                .scheduledDate(maintenanceRecord.getScheduledDate())
                .completedDate(maintenanceRecord.getCompletedDate())
                .technicianId(maintenanceRecord.getTechnicianId())
                .notes(maintenanceRecord.getNotes())
                .build();
    }

    public EquipmentMovementDTO toDTO(EquipmentMovement movement) {
        return EquipmentMovementDTO.builder()
                .id(movement.getId())
                .equipmentId(movement.getEquipmentId())
                .movementType(movement.getMovementType())
                .quantity(movement.getQuantity())
                .reason(movement.getReason())
                .notes(movement.getNotes())
                .previousStock(movement.getPreviousStock())
                .newStock(movement.getNewStock())
                .userId(movement.getUserId())
                .timestamp(movement.getTimestamp())
                .build();
    }

    public InventoryUsageDTO toDTO(InventoryUsage usage) {
        return InventoryUsageDTO.builder()
                .id(usage.getId())
                .equipmentId(usage.getEquipmentId())
                .ticketId(usage.getTicketId())
                .interventionId(usage.getInterventionId())
                .quantityUsed(usage.getQuantityUsed())
                .costPerUnit(usage.getCostPerUnit())
                .totalCost(usage.getTotalCost())
                .usedBy(usage.getUsedBy())
                .usedAt(usage.getUsedAt())
                .build();
    }

    public InterventionDTO toDTO(Intervention intervention, List<InventoryUsage> usages) {
        if (intervention == null) {
            return null;
        }
        return InterventionDTO.builder()
                .id(intervention.getId())
                .ticketId(intervention.getTicketId())
                .technicianId(intervention.getTechnicianId())
                .workPerformed(intervention.getWorkPerformed())
                .rootCause(intervention.getRootCause())
                .resolution(intervention.getResolution())
                .preventiveMeasures(intervention.getPreventiveMeasures())
                .timeSpentHours(intervention.getTimeSpentHours())
                .followUpRequired(intervention.getFollowUpRequired())
                .followUpNotes(intervention.getFollowUpNotes())
                .totalCost(intervention.getTotalCost())
                .completedAt(intervention.getCompletedAt())
                .partsUsed(usages.stream().map(this::toDTO).toList())
                .build();
    }
}
