package org.example.restaurantfieldservice.repository;

import org.example.restaurantfieldservice.entity.EquipmentMovement;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface EquipmentMovementRepository extends JpaRepository<EquipmentMovement, Long> {

    List<EquipmentMovement> findByEquipmentIdOrderByTimestampDesc(Long equipmentId);
}
