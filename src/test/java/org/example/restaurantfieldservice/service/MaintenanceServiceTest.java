package org.example.restaurantfieldservice.service;

import org.example.restaurantfieldservice.dto.MaintenanceRecordDTO;
import org.example.restaurantfieldservice.entity.Device;
import org.example.restaurantfieldservice.entity.MaintenanceRecord;
import org.example.restaurantfieldservice.enums.DeviceStatus;
import org.example.restaurantfieldservice.enums.MaintenanceStatus;
import org.example.restaurantfieldservice.enums.UserRole;
import org.example.restaurantfieldservice.event.EntityChangeEvent;
import org.example.restaurantfieldservice.exception.InvalidTicketOperationException;
import org.example.restaurantfieldservice.exception.PermissionDeniedException;
import org.example.restaurantfieldservice.lifecycle.SlaPolicy;
import org.example.restaurantfieldservice.mapper.ResourceMapper;
import org.example.restaurantfieldservice.repository.DeviceRepository;
import org.example.restaurantfieldservice.repository.MaintenanceRecordRepository;
import org.example.restaurantfieldservice.session.SessionContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("MaintenanceService")
class MaintenanceServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    @Mock private MaintenanceRecordRepository maintenanceRepository;
    @Mock private DeviceRepository deviceRepository;
    @Mock private ApplicationEventPublisher eventPublisher;

    private MaintenanceService maintenanceService;

    private final SessionContext technician = SessionContext.builder()
            .userId(7L).name("Tina").email("tech@test").role(UserRole.TECHNICIAN).build();

    @BeforeEach
    void setUp() {
        maintenanceService = new MaintenanceService(maintenanceRepository, deviceRepository, new ResourceMapper(),
                new SlaPolicy(Clock.fixed(NOW, ZoneOffset.UTC)), eventPublisher);
    }

    private MaintenanceRecord scheduledVisit() {
        return MaintenanceRecord.builder()
                .id(5L)
                .deviceId(3L)
                .maintenanceType("Descaling")
                .status(MaintenanceStatus.SCHEDULED)
                .scheduledDate(LocalDateTime.of(2026, 3, 1, 9, 0))
                .build();
    }

    @Nested
    @DisplayName("complete")
    class Complete {

        @Test
        @DisplayName("puts the device back in operation and stamps its last maintenance")
        void deviceBackToOperational() {
            Device device = Device.builder().id(3L).name("Espresso Machine").status(DeviceStatus.MAINTENANCE).build();
            when(maintenanceRepository.findById(5L)).thenReturn(Optional.of(scheduledVisit()));
            when(maintenanceRepository.save(any(MaintenanceRecord.class))).thenAnswer(inv -> inv.getArgument(0));
            when(deviceRepository.findById(3L)).thenReturn(Optional.of(device));

            MaintenanceRecordDTO result = maintenanceService.complete(5L, "Gaskets replaced", technician);

            LocalDateTime now = LocalDateTime.ofInstant(NOW, ZoneOffset.UTC);
            assertThat(result.getStatus()).isEqualTo(MaintenanceStatus.COMPLETED);
            assertThat(result.getCompletedDate()).isEqualTo(now);
            assertThat(result.getNotes()).isEqualTo("Gaskets replaced");
            assertThat(result.getTechnicianId()).isEqualTo(7L);

            ArgumentCaptor<Device> savedDevice = ArgumentCaptor.forClass(Device.class);
            verify(deviceRepository).save(savedDevice.capture());
            assertThat(savedDevice.getValue().getStatus()).isEqualTo(DeviceStatus.OPERATIONAL);
            assertThat(savedDevice.getValue().getLastMaintenanceAt()).isEqualTo(now);

            ArgumentCaptor<EntityChangeEvent> events = ArgumentCaptor.forClass(EntityChangeEvent.class);
            verify(eventPublisher, times(2)).publishEvent(events.capture());
            assertThat(events.getAllValues()).extracting(EntityChangeEvent::getTable)
                    .containsExactly("maintenance_records", "devices");
        }

        @Test
        void alreadyCompletedVisitIsRejected() {
            MaintenanceRecord done = scheduledVisit();
            done.setStatus(MaintenanceStatus.COMPLETED);
            when(maintenanceRepository.findById(5L)).thenReturn(Optional.of(done));

            assertThatThrownBy(() -> maintenanceService.complete(5L, null, technician))
                    .isInstanceOf(InvalidTicketOperationException.class)
                    .hasMessageContaining("already completed");
            verify(deviceRepository, never()).save(any());
        }

        @Test
        @DisplayName("restaurant staff cannot close a visit")
        void staffCannotComplete() {
            SessionContext staff = SessionContext.builder().userId(20L).role(UserRole.RESTAURANT_STAFF).build();

            assertThatThrownBy(() -> maintenanceService.complete(5L, null, staff))
                    .isInstanceOf(PermissionDeniedException.class);
            verifyNoInteractions(maintenanceRepository, deviceRepository, eventPublisher);
        }
    }
}
