package org.example.restaurantfieldservice.repository;

import org.example.restaurantfieldservice.entity.Ticket;
import org.example.restaurantfieldservice.enums.TicketStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for tickets. Filtered listing goes through
 * {@link JpaSpecificationExecutor}; dashboard tabs use the derived queries.
 */
@Repository
public interface TicketRepository extends JpaRepository<Ticket, Long>, JpaSpecificationExecutor<Ticket> {

    // ==================== READ OPERATIONS ====================

    Optional<Ticket> findByTicketNumber(String ticketNumber);

    boolean existsByTicketNumber(String ticketNumber);

    List<Ticket> findByRestaurantIdOrderByCreatedAtDesc(Long restaurantId);

    List<Ticket> findByDeviceIdOrderByCreatedAtDesc(Long deviceId);

    List<Ticket> findByAssignedToAndStatusInOrderBySlaDueAtAsc(Long assignedTo, Collection<TicketStatus> statuses);

    List<Ticket> findByAssignedToAndStatusOrderByResolvedAtDesc(Long assignedTo, TicketStatus status);

    long countByStatus(TicketStatus status);

    // ==================== CUSTOM QUERIES ====================

    /**
     * Tickets a technician can pick up: new or assigned without an assignee.
     */
    @Query("SELECT t FROM Ticket t WHERE t.assignedTo IS NULL AND t.status IN :statuses ORDER BY t.slaDueAt ASC")
    List<Ticket> findAvailable(@Param("statuses") Collection<TicketStatus> statuses);

    @Query("SELECT COUNT(t) FROM Ticket t WHERE t.slaDueAt < :now AND t.status NOT IN :terminal")
    long countOverdue(@Param("now") LocalDateTime now, @Param("terminal") Collection<TicketStatus> terminal);
}
