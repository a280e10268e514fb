package org.example.restaurantfieldservice.service;

import jakarta.persistence.criteria.Predicate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.restaurantfieldservice.dto.DeviceDTO;
import org.example.restaurantfieldservice.dto.DeviceRequest;
import org.example.restaurantfieldservice.dto.PagedResponse;
import org.example.restaurantfieldservice.entity.Device;
import org.example.restaurantfieldservice.enums.ChangeOperation;
import org.example.restaurantfieldservice.enums.DeviceStatus;
import org.example.restaurantfieldservice.enums.UserRole;
import org.example.restaurantfieldservice.event.EntityChangeEvent;
import org.example.restaurantfieldservice.exception.DuplicateResourceException;
import org.example.restaurantfieldservice.exception.ResourceNotFoundException;
import org.example.restaurantfieldservice.mapper.ResourceMapper;
import org.example.restaurantfieldservice.repository.DeviceRepository;
import org.example.restaurantfieldservice.repository.RestaurantRepository;
import org.example.restaurantfieldservice.session.AccessGuard;
import org.example.restaurantfieldservice.session.SessionContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class DeviceService {

    static final String TABLE = "devices";

    private final DeviceRepository deviceRepository;
    private final RestaurantRepository restaurantRepository;
    private final ResourceMapper mapper;
    private final ApplicationEventPublisher eventPublisher;

    // ==================== READ ====================

    @Transactional(readOnly = true)
    public PagedResponse<DeviceDTO> getDevices(DeviceStatus status, Long restaurantId, String type, String search,
                                               int page, int size) {
        Specification<Device> spec = (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (status != null) {
                predicates.add(cb.equal(root.get("status"), status));
            }
            if (restaurantId != null && restaurantId > 0) {
                predicates.add(cb.equal(root.get("restaurantId"), restaurantId));
            }
            if (StringUtils.hasText(type)) {
                predicates.add(cb.equal(cb.lower(root.get("type")), type.trim().toLowerCase()));
            }
            if (StringUtils.hasText(search)) {
                String pattern = "%" + search.trim().toLowerCase() + "%";
                predicates.add(cb.or(
                        cb.like(cb.lower(root.get("name")), pattern),
                        cb.like(cb.lower(root.get("serialNumber")), pattern),
                        cb.like(cb.lower(root.get("model")), pattern)));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
        return PagedResponse.from(
                deviceRepository.findAll(spec, PageRequest.of(page, size, Sort.by("name").ascending())),
                mapper::toDTO);
    }

    @Transactional(readOnly = true)
    public DeviceDTO getDevice(Long id) {
        return mapper.toDTO(findDevice(id));
    }

    @Transactional(readOnly = true)
    public DeviceDTO getBySerialNumber(String serialNumber) {
        return deviceRepository.findBySerialNumberIgnoreCase(serialNumber.trim())
                .map(mapper::toDTO)
                .orElseThrow(() -> new ResourceNotFoundException("Device", "serialNumber", serialNumber));
    }

    @Transactional(readOnly = true)
    public List<DeviceDTO> getByRestaurant(Long restaurantId) {
        return deviceRepository.findByRestaurantIdOrderByNameAsc(restaurantId).stream()
                .map(mapper::toDTO)
                .toList();
    }

    // ==================== WRITE ====================

    public DeviceDTO createDevice(DeviceRequest request, SessionContext session) {
        AccessGuard.requireAnyRole(session, "create device", UserRole.ADMIN, UserRole.MANAGER);
        if (deviceRepository.existsBySerialNumberIgnoreCase(request.getSerialNumber().trim())) {
            throw new DuplicateResourceException("Device", "serialNumber", request.getSerialNumber().trim());
        }
        requireRestaurant(request.getRestaurantId());

        Device device = new Device();
        apply(device, request);
        if (request.getStatus() == null) {
            device.setStatus(DeviceStatus.OPERATIONAL);
        }
        Device saved = deviceRepository.save(device);
        eventPublisher.publishEvent(new EntityChangeEvent(this, TABLE, saved.getId(), ChangeOperation.INSERT));
        log.info("✅ Device created - id: {}, serial: {}", saved.getId(), saved.getSerialNumber());
        return mapper.toDTO(saved);
    }

    public DeviceDTO updateDevice(Long id, DeviceRequest request, SessionContext session) {
        AccessGuard.requireAnyRole(session, "edit device", UserRole.ADMIN, UserRole.MANAGER);
        Device device = findDevice(id);
        String serial = request.getSerialNumber().trim();
        if (!serial.equalsIgnoreCase(device.getSerialNumber()) && deviceRepository.existsBySerialNumberIgnoreCase(serial)) {
            throw new DuplicateResourceException("Device", "serialNumber", serial);
        }
        requireRestaurant(request.getRestaurantId());

        apply(device, request);
        Device saved = deviceRepository.save(device);
        eventPublisher.publishEvent(new EntityChangeEvent(this, TABLE, saved.getId(), ChangeOperation.UPDATE));
        log.info("✅ Device updated - id: {}", id);
        return mapper.toDTO(saved);
    }

    /**
     * Technicians may flag a device they are working on, so no role check here.
     */
    public DeviceDTO updateStatus(Long id, DeviceStatus status, SessionContext session) {
        Device device = findDevice(id);
        DeviceStatus previous = device.getStatus();
        device.setStatus(status);
        Device saved = deviceRepository.save(device);
        eventPublisher.publishEvent(new EntityChangeEvent(this, TABLE, saved.getId(), ChangeOperation.UPDATE));
        log.info("🔄 Device {} status {} -> {} by {}", id, previous, status, session.getUserId());
        return mapper.toDTO(saved);
    }

    // ==================== HELPERS ====================

    private Device findDevice(Long id) {
        return deviceRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Device", id));
    }

    private void requireRestaurant(Long restaurantId) {
        if (!restaurantRepository.existsById(restaurantId)) {
            throw new ResourceNotFoundException("Restaurant", restaurantId);
        }
    }

    private void apply(Device device, DeviceRequest request) {
        device.setName(request.getName().trim());
        device.setType(request.getType().trim());
        device.setSerialNumber(request.getSerialNumber().trim());
        device.setModel(request.getModel());
        device.setRestaurantId(request.getRestaurantId());
        device.setInstallationDate(request.getInstallationDate());
        if (request.getStatus() != null) {
            device.setStatus(request.getStatus());
        }
    }
}
