package org.example.restaurantfieldservice.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.restaurantfieldservice.dto.MaintenanceRecordDTO;
import org.example.restaurantfieldservice.dto.MaintenanceRequest;
import org.example.restaurantfieldservice.entity.Device;
import org.example.restaurantfieldservice.entity.MaintenanceRecord;
import org.example.restaurantfieldservice.enums.ChangeOperation;
import org.example.restaurantfieldservice.enums.DeviceStatus;
import org.example.restaurantfieldservice.enums.MaintenanceStatus;
import org.example.restaurantfieldservice.enums.UserRole;
import org.example.restaurantfieldservice.event.EntityChangeEvent;
import org.example.restaurantfieldservice.exception.InvalidTicketOperationException;
import org.example.restaurantfieldservice.exception.ResourceNotFoundException;
import org.example.restaurantfieldservice.lifecycle.SlaPolicy;
import org.example.restaurantfieldservice.mapper.ResourceMapper;
import org.example.restaurantfieldservice.repository.DeviceRepository;
import org.example.restaurantfieldservice.repository.MaintenanceRecordRepository;
import org.example.restaurantfieldservice.session.AccessGuard;
import org.example.restaurantfieldservice.session.SessionContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Preventive maintenance visits, planned per device.
 */
@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class MaintenanceService {

    static final String TABLE = "maintenance_records";

    private final MaintenanceRecordRepository maintenanceRepository;
    private final DeviceRepository deviceRepository;
    private final ResourceMapper mapper;
    private final SlaPolicy slaPolicy;
    private final ApplicationEventPublisher eventPublisher;

    @Transactional(readOnly = true)
    public List<MaintenanceRecordDTO> getForDevice(Long deviceId) {
        return maintenanceRepository.findByDeviceIdOrderByScheduledDateDesc(deviceId).stream()
                .map(mapper::toDTO)
                .toList();
    }

    /**
     * Scheduled visits due within {@code days} from now, overdue ones included.
     */
    @Transactional(readOnly = true)
    public List<MaintenanceRecordDTO> getUpcoming(int days) {
        LocalDateTime horizon = slaPolicy.now().plusDays(Math.max(days, 0));
        return maintenanceRepository
                .findByStatusAndScheduledDateBeforeOrderByScheduledDateAsc(MaintenanceStatus.SCHEDULED, horizon)
                .stream()
                .map(mapper::toDTO)
                .toList();
    }

    public MaintenanceRecordDTO schedule(MaintenanceRequest request, SessionContext session) {
        AccessGuard.requireAnyRole(session, "schedule maintenance",
                UserRole.ADMIN, UserRole.MANAGER, UserRole.TECHNICIAN, UserRole.SOFTWARE_TECH);
        if (!deviceRepository.existsById(request.getDeviceId())) {
            throw new ResourceNotFoundException("Device", request.getDeviceId());
        }

        MaintenanceRecord saved = maintenanceRepository.save(MaintenanceRecord.builder()
                .deviceId(request.getDeviceId())
                .maintenanceType(request.getMaintenanceType().trim())
                .description(request.getDescription())
                .scheduledDate(request.getScheduledDate())
                .technicianId(request.getTechnicianId() != null ? request.getTechnicianId() : session.getUserId())
                .status(MaintenanceStatus.SCHEDULED)
                .build());
        eventPublisher.publishEvent(new EntityChangeEvent(this, TABLE, saved.getId(), ChangeOperation.INSERT));
        log.info("🗓️ Maintenance {} scheduled for device {} on {}",
                saved.getId(), saved.getDeviceId(), saved.getScheduledDate());
        return mapper.toDTO(saved);
    }

    /**
     * Marks the visit done and puts the device back in operation.
     */
    public MaintenanceRecordDTO complete(Long id, String notes, SessionContext session) {
        AccessGuard.requireAnyRole(session, "complete maintenance",
                UserRole.ADMIN, UserRole.MANAGER, UserRole.TECHNICIAN, UserRole.SOFTWARE_TECH);
        MaintenanceRecord maintenanceRecord = maintenanceRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Maintenance record", id));
        if (maintenanceRecord.getStatus() == MaintenanceStatus.COMPLETED) {
            throw new InvalidTicketOperationException("completeMaintenance", "Maintenance " + id + " is already completed");
        }

        LocalDateTime now = slaPolicy.now();
        maintenanceRecord.setStatus(MaintenanceStatus.COMPLETED);
        maintenanceRecord.setCompletedDate(now);
        maintenanceRecord.setNotes(notes);
        if (maintenanceRecord.getTechnicianId() == null) {
            maintenanceRecord.setTechnicianId(session.getUserId());
        }
        MaintenanceRecord saved = maintenanceRepository.save(maintenanceRecord);

        Device device = deviceRepository.findById(saved.getDeviceId())
                .orElseThrow(() -> new ResourceNotFoundException("Device", saved.getDeviceId()));
        device.setStatus(DeviceStatus.OPERATIONAL);
        device.setLastMaintenanceAt(now);
        deviceRepository.save(device);

        eventPublisher.publishEvent(new EntityChangeEvent(this, TABLE, saved.getId(), ChangeOperation.UPDATE));
        eventPublisher.publishEvent(new EntityChangeEvent(this, DeviceService.TABLE, device.getId(), ChangeOperation.UPDATE));
        log.info("✅ Maintenance {} completed, device {} operational", id, device.getId());
        return mapper.toDTO(saved);
    }
}
