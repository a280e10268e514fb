package org.example.restaurantfieldservice.offline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * FIFO of pending offline writes, kept in the Redis list {@code offline:pending_actions}.
 *
 * <p>Producers append with RPUSH. Only {@link OfflineSyncService} reads, always
 * from the head, so replay follows enqueue order.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OfflineActionQueue {

    static final String QUEUE_KEY = "offline:pending_actions";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    /**
     * @throws IllegalStateException if the action cannot be stored
     */
    public void enqueue(OfflineAction action) {
        try {
            Long size = redisTemplate.opsForList().rightPush(QUEUE_KEY, objectMapper.writeValueAsString(action));
            log.info("📥 Queued offline {} on {}#{} (queue size {})",
                    action.getType(), action.getTable(), action.getRowId(), size);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Offline action could not be serialized: " + e.getOriginalMessage(), e);
        } catch (Exception e) {
            log.error("❌ REDIS ERROR - Could not queue offline action {}: {}", action.getId(), e.getMessage());
            throw new IllegalStateException("Offline queue unavailable", e);
        }
    }

    public Optional<OfflineAction> peek() {
        String json = redisTemplate.opsForList().index(QUEUE_KEY, 0);
        return Optional.ofNullable(json).map(this::readAction);
    }

    public void removeHead() {
        redisTemplate.opsForList().leftPop(QUEUE_KEY);
    }

    /**
     * Overwrites the head in place, used to persist a retry count.
     */
    public void replaceHead(OfflineAction action) {
        try {
            redisTemplate.opsForList().set(QUEUE_KEY, 0, objectMapper.writeValueAsString(action));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Offline action could not be serialized: " + e.getOriginalMessage(), e);
        }
    }

    public long size() {
        try {
            Long size = redisTemplate.opsForList().size(QUEUE_KEY);
            return size != null ? size : 0L;
        } catch (Exception e) {
            log.warn("⚠️ REDIS ERROR - Could not read offline queue size: {}", e.getMessage());
            return -1L;
        }
    }

    public List<OfflineAction> snapshot() {
        List<String> raw = redisTemplate.opsForList().range(QUEUE_KEY, 0, -1);
        List<OfflineAction> actions = new ArrayList<>();
        if (raw != null) {
            raw.forEach(json -> actions.add(readAction(json)));
        }
        return actions;
    }

    private OfflineAction readAction(String json) {
        try {
            return objectMapper.readValue(json, OfflineAction.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt offline action in queue: " + e.getOriginalMessage(), e);
        }
    }
}
