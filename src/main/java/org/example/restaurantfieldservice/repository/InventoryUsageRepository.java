package org.example.restaurantfieldservice.repository;

import org.example.restaurantfieldservice.entity.InventoryUsage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface InventoryUsageRepository extends JpaRepository<InventoryUsage, Long> {

    List<InventoryUsage> findByTicketId(Long ticketId);

    List<InventoryUsage> findByInterventionId(Long interventionId);
}
