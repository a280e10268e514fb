package org.example.restaurantfieldservice.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.restaurantfieldservice.dto.OverviewStatsDTO;
import org.example.restaurantfieldservice.dto.TechnicianDashboardDTO;
import org.example.restaurantfieldservice.dto.TicketDTO;
import org.example.restaurantfieldservice.entity.Ticket;
import org.example.restaurantfieldservice.enums.DeviceStatus;
import org.example.restaurantfieldservice.enums.TicketStatus;
import org.example.restaurantfieldservice.enums.UserRole;
import org.example.restaurantfieldservice.lifecycle.SlaPolicy;
import org.example.restaurantfieldservice.mapper.TicketMapper;
import org.example.restaurantfieldservice.repository.DeviceRepository;
import org.example.restaurantfieldservice.repository.EquipmentItemRepository;
import org.example.restaurantfieldservice.repository.TicketRepository;
import org.example.restaurantfieldservice.session.AccessGuard;
import org.example.restaurantfieldservice.session.SessionContext;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@Transactional(readOnly = true)
@RequiredArgsConstructor
public class DashboardService {

    private static final EnumSet<TicketStatus> AVAILABLE = EnumSet.of(TicketStatus.NEW, TicketStatus.ASSIGNED);
    private static final EnumSet<TicketStatus> ACTIVE = EnumSet.of(TicketStatus.ASSIGNED, TicketStatus.IN_PROGRESS);
    private static final EnumSet<TicketStatus> TERMINAL = EnumSet.of(TicketStatus.RESOLVED, TicketStatus.CLOSED);

    private final TicketRepository ticketRepository;
    private final DeviceRepository deviceRepository;
    private final EquipmentItemRepository equipmentRepository;
    private final TicketMapper ticketMapper;
    private final SlaPolicy slaPolicy;

    /**
     * Available tickets are shared by everyone; the other tabs only hold the caller's own work.
     */
    public TechnicianDashboardDTO getTechnicianDashboard(SessionContext session) {
        Long me = session.getUserId();
        TechnicianDashboardDTO dashboard = TechnicianDashboardDTO.builder()
                .available(toDTOs(ticketRepository.findAvailable(AVAILABLE)))
                .assigned(toDTOs(ticketRepository.findByAssignedToAndStatusInOrderBySlaDueAtAsc(me, ACTIVE)))
                .scheduled(toDTOs(ticketRepository.findByAssignedToAndStatusInOrderBySlaDueAtAsc(
                        me, EnumSet.of(TicketStatus.SCHEDULED))))
                .completed(toDTOs(ticketRepository.findByAssignedToAndStatusOrderByResolvedAtDesc(
                        me, TicketStatus.RESOLVED)))
                .build();

        log.debug("Dashboard for user {} - available: {}, assigned: {}, scheduled: {}, completed: {}",
                me, dashboard.getAvailable().size(), dashboard.getAssigned().size(),
                dashboard.getScheduled().size(), dashboard.getCompleted().size());
        return dashboard;
    }

    public OverviewStatsDTO getOverview(SessionContext session) {
        AccessGuard.requireAnyRole(session, "view the overview", UserRole.ADMIN, UserRole.MANAGER);

        Map<TicketStatus, Long> byStatus = new EnumMap<>(TicketStatus.class);
        long total = 0;
        for (TicketStatus status : TicketStatus.values()) {
            long count = ticketRepository.countByStatus(status);
            byStatus.put(status, count);
            total += count;
        }

        return OverviewStatsDTO.builder()
                .ticketsByStatus(byStatus)
                .totalTickets(total)
                .overdueTickets(ticketRepository.countOverdue(slaPolicy.now(), TERMINAL))
                .lowStockItems(equipmentRepository.countLowStock())
                .devicesInMaintenance(deviceRepository.countByStatus(DeviceStatus.MAINTENANCE))
                .build();
    }

    private List<TicketDTO> toDTOs(List<Ticket> tickets) {
        return tickets.stream().map(ticketMapper::toDTO).toList();
    }
}
