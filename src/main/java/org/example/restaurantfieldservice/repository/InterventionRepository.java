package org.example.restaurantfieldservice.repository;

import org.example.restaurantfieldservice.entity.Intervention;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface InterventionRepository extends JpaRepository<Intervention, Long> {

    Optional<Intervention> findFirstByTicketIdOrderByCompletedAtDesc(Long ticketId);
}
