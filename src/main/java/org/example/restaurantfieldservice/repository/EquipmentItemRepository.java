package org.example.restaurantfieldservice.repository;

import org.example.restaurantfieldservice.entity.EquipmentItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface EquipmentItemRepository extends JpaRepository<EquipmentItem, Long> {

    List<EquipmentItem> findByNameContainingIgnoreCaseOrderByNameAsc(String name);

    @Query("SELECT e FROM EquipmentItem e WHERE e.minStockLevel IS NOT NULL AND e.stockLevel <= e.minStockLevel ORDER BY e.stockLevel ASC")
    List<EquipmentItem> findLowStock();

    @Query("SELECT COUNT(e) FROM EquipmentItem e WHERE e.minStockLevel IS NOT NULL AND e.stockLevel <= e.minStockLevel")
    long countLowStock();
}
