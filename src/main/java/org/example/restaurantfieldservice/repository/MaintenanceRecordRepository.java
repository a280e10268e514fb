package org.example.restaurantfieldservice.repository;

import org.example.restaurantfieldservice.entity.MaintenanceRecord;
import org.example.restaurantfieldservice.enums.MaintenanceStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface MaintenanceRecordRepository extends JpaRepository<MaintenanceRecord, Long> {

    List<MaintenanceRecord> findByDeviceIdOrderByScheduledDateDesc(Long deviceId);

    List<MaintenanceRecord> findByStatusAndScheduledDateBeforeOrderByScheduledDateAsc(
            MaintenanceStatus status, LocalDateTime before);
}
