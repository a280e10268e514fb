package org.example.restaurantfieldservice.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.restaurantfieldservice.dto.HealthStatusDTO;
import org.example.restaurantfieldservice.dto.WriteProbeResult;
import org.example.restaurantfieldservice.entity.Device;
import org.example.restaurantfieldservice.entity.Ticket;
import org.example.restaurantfieldservice.enums.TicketPriority;
import org.example.restaurantfieldservice.enums.TicketStatus;
import org.example.restaurantfieldservice.lifecycle.SlaPolicy;
import org.example.restaurantfieldservice.offline.ConnectivityMonitor;
import org.example.restaurantfieldservice.offline.OfflineActionQueue;
import org.example.restaurantfieldservice.repository.DeviceRepository;
import org.example.restaurantfieldservice.repository.TicketRepository;
import org.example.restaurantfieldservice.session.AccessGuard;
import org.example.restaurantfieldservice.session.SessionContext;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class SystemHealthService {

    private final ConnectivityMonitor connectivityMonitor;
    private final OfflineActionQueue offlineQueue;
    private final TicketRepository ticketRepository;
    private final DeviceRepository deviceRepository;
    private final SlaPolicy slaPolicy;

    public HealthStatusDTO health() {
        boolean reachable = connectivityMonitor.probe();
        long pending = offlineQueue.size();
        String status;
        if (!reachable) {
            status = "OFFLINE";
        } else if (pending > 0) {
            status = "SYNCING";
        } else {
            status = "UP";
        }
        return HealthStatusDTO.builder()
                .status(status)
                .databaseReachable(reachable)
                .online(connectivityMonitor.isOnline())
                .pendingOfflineActions(Math.max(pending, 0))
                .checkedAt(slaPolicy.now())
                .build();
    }

    /**
     * Inserts a throwaway ticket on the first device and deletes it again.
     * Goes straight to the repository so no notification, cache or change event fires.
     */
    @Transactional
    public WriteProbeResult writeProbe(SessionContext session) {
        AccessGuard.requireAdmin(session, "run the write probe");
        long started = System.currentTimeMillis();

        Optional<Device> device = deviceRepository.findFirstByOrderByIdAsc();
        if (device.isEmpty()) {
            return WriteProbeResult.builder()
                    .success(false)
                    .error("No device available to attach the probe ticket to")
                    .elapsedMillis(System.currentTimeMillis() - started)
                    .build();
        }

        Ticket probe = ticketRepository.saveAndFlush(Ticket.builder()
                .ticketNumber("PROBE-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase())
                .title("Write probe")
                .status(TicketStatus.NEW)
                .priority(TicketPriority.LOW)
                .deviceId(device.get().getId())
                .restaurantId(device.get().getRestaurantId())
                .createdBy(session.getUserId())
                .createdAt(slaPolicy.now())
                .slaDueAt(slaPolicy.standardDueDate(TicketPriority.LOW))
                .build());
        ticketRepository.delete(probe);
        ticketRepository.flush();

        long elapsed = System.currentTimeMillis() - started;
        log.info("🧪 Write probe succeeded - ticket {} inserted and deleted in {} ms", probe.getId(), elapsed);
        return WriteProbeResult.builder()
                .success(true)
                .probeTicketId(probe.getId())
                .elapsedMillis(elapsed)
                .build();
    }
}
