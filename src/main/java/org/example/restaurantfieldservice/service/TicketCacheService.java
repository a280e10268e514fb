package org.example.restaurantfieldservice.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.restaurantfieldservice.dto.TicketDTO;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Ticket view cache in Redis.
 *
 * <p>Keys: {@code ticket:{id}} and {@code ticket:number:{ticketNumber}}, JSON values
 * with a configurable TTL. Redis failures are logged and treated as a miss so the
 * database stays the source of truth.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TicketCacheService {

    private static final String TICKET_CACHE_PREFIX = "ticket:";
    private static final String TICKET_NUMBER_PREFIX = "ticket:number:";

    private final RedisTemplate<String, Object> redisTemplate;

    @Value("${app.cache.ttl-minutes:30}")
    private long ttlMinutes = 30;

    // ==================== GET Operations ====================

    public Optional<TicketDTO> getTicketById(Long id) {
        return read(buildTicketKey(id));
    }

    public Optional<TicketDTO> getTicketByNumber(String ticketNumber) {
        return read(buildTicketNumberKey(ticketNumber));
    }

    // ==================== PUT Operations ====================

    public void cacheTicket(TicketDTO ticket) {
        if (ticket == null || ticket.getId() == null) {
            return;
        }
        try {
            redisTemplate.opsForValue().set(buildTicketKey(ticket.getId()), ticket, ttlMinutes, TimeUnit.MINUTES);
            if (ticket.getTicketNumber() != null) {
                redisTemplate.opsForValue().set(buildTicketNumberKey(ticket.getTicketNumber()), ticket,
                        ttlMinutes, TimeUnit.MINUTES);
            }
            log.debug("💾 Cached ticket view {} (pendingSync={}, TTL {} min)",
                    ticket.getId(), ticket.isPendingSync(), ttlMinutes);
        } catch (Exception e) {
            log.warn("⚠️ REDIS ERROR - Error caching ticket {}: {}", ticket.getId(), e.getMessage());
        }
    }

    // ==================== EVICT Operations ====================

    public void evictTicket(Long id, String ticketNumber) {
        try {
            redisTemplate.delete(buildTicketKey(id));
            if (ticketNumber != null) {
                redisTemplate.delete(buildTicketNumberKey(ticketNumber));
            }
            log.debug("Evicted ticket view {}", id);
        } catch (Exception e) {
            log.warn("⚠️ REDIS ERROR - Error evicting ticket {}: {}", id, e.getMessage());
        }
    }

    public boolean isTicketCached(Long id) {
        try {
            return Boolean.TRUE.equals(redisTemplate.hasKey(buildTicketKey(id)));
        } catch (Exception e) {
            log.warn("Error checking ticket cache for ID {}: {}", id, e.getMessage());
            return false;
        }
    }

    // ==================== Helpers ====================

    private Optional<TicketDTO> read(String key) {
        try {
            Object cached = redisTemplate.opsForValue().get(key);
            if (cached instanceof TicketDTO) {
                log.debug("🟢 Cache HIT - {}", key);
                return Optional.of((TicketDTO) cached);
            }
            log.debug("🔴 Cache MISS - {}", key);
            return Optional.empty();
        } catch (Exception e) {
            log.warn("⚠️ REDIS ERROR - Error reading {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private String buildTicketKey(Long id) {
        return TICKET_CACHE_PREFIX + id;
    }

    private String buildTicketNumberKey(String ticketNumber) {
        return TICKET_NUMBER_PREFIX + ticketNumber;
    }
}
