package org.example.restaurantfieldservice.service;

import org.example.restaurantfieldservice.dto.DeviceDTO;
import org.example.restaurantfieldservice.entity.Device;
import org.example.restaurantfieldservice.enums.DeviceStatus;
import org.example.restaurantfieldservice.exception.ResourceNotFoundException;
import org.example.restaurantfieldservice.mapper.ResourceMapper;
import org.example.restaurantfieldservice.repository.DeviceRepository;
import org.example.restaurantfieldservice.repository.RestaurantRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("DeviceService")
class DeviceServiceTest {

    @Mock private DeviceRepository deviceRepository;
    @Mock private RestaurantRepository restaurantRepository;
    @Mock private ApplicationEventPublisher eventPublisher;

    private DeviceService deviceService;

    @BeforeEach
    void setUp() {
        deviceService = new DeviceService(deviceRepository, restaurantRepository, new ResourceMapper(), eventPublisher);
    }

    @Test
    @DisplayName("looks a device up by its trimmed serial number")
    void findsBySerialNumber() {
        when(deviceRepository.findBySerialNumberIgnoreCase("FRY-1001")).thenReturn(Optional.of(Device.builder()
                .id(3L).name("Fryer 1").serialNumber("FRY-1001").status(DeviceStatus.OPERATIONAL).restaurantId(2L)
                .build()));

        DeviceDTO device = deviceService.getBySerialNumber("  FRY-1001 ");

        assertThat(device.getId()).isEqualTo(3L);
        assertThat(device.getStatus()).isEqualTo(DeviceStatus.OPERATIONAL);
    }

    @Test
    void unknownSerialNumberIs404() {
        when(deviceRepository.findBySerialNumberIgnoreCase("NOPE-1")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> deviceService.getBySerialNumber("NOPE-1"))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Device not found with serialNumber: NOPE-1");
    }
}
