package org.example.restaurantfieldservice.repository;

import org.example.restaurantfieldservice.entity.TicketHistory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TicketHistoryRepository extends JpaRepository<TicketHistory, Long> {

    List<TicketHistory> findByTicketIdOrderByTimestampAsc(Long ticketId);
}
