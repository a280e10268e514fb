package org.example.restaurantfieldservice.repository;

import org.example.restaurantfieldservice.entity.Device;
import org.example.restaurantfieldservice.enums.DeviceStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface DeviceRepository extends JpaRepository<Device, Long>, JpaSpecificationExecutor<Device> {

    Optional<Device> findBySerialNumberIgnoreCase(String serialNumber);

    boolean existsBySerialNumberIgnoreCase(String serialNumber);

    List<Device> findByRestaurantIdOrderByNameAsc(Long restaurantId);

    long countByStatus(DeviceStatus status);

    Optional<Device> findFirstByOrderByIdAsc();
}
