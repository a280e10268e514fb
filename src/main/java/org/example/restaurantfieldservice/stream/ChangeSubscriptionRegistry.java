package org.example.restaurantfieldservice.stream;

import lombok.extern.slf4j.Slf4j;
import org.example.restaurantfieldservice.kafka.dto.EntityChangeMessage;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Live change-stream subscribers, grouped by table. The pseudo-table {@code *}
 * receives every change.
 */
@Slf4j
@Component
public class ChangeSubscriptionRegistry {

    public static final String ALL_TABLES = "*";
    static final String EVENT_NAME = "change";

    private final Map<String, List<SseEmitter>> subscribers = new ConcurrentHashMap<>();

    @Value("${app.changes.emitter-timeout-ms:1800000}")
    private long emitterTimeoutMs = 1_800_000L;

    public SseEmitter subscribe(String table) {
        String key = table.trim().toLowerCase();
        SseEmitter emitter = new SseEmitter(emitterTimeoutMs);
        List<SseEmitter> emitters = subscribers.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>());
        emitters.add(emitter);

        emitter.onCompletion(() -> emitters.remove(emitter));
        emitter.onTimeout(() -> {
            emitters.remove(emitter);
            emitter.complete();
        });
        emitter.onError(e -> emitters.remove(emitter));

        log.debug("👂 Subscribed to {} changes ({} listeners)", key, emitters.size());
        return emitter;
    }

    /**
     * @return number of subscribers the change was delivered to
     */
    public int broadcast(EntityChangeMessage message) {
        int delivered = deliver(message.getTable(), message);
        delivered += deliver(ALL_TABLES, message);
        return delivered;
    }

    public int subscriberCount(String table) {
        List<SseEmitter> emitters = subscribers.get(table);
        return emitters == null ? 0 : emitters.size();
    }

    private int deliver(String table, EntityChangeMessage message) {
        List<SseEmitter> emitters = subscribers.get(table);
        if (emitters == null || emitters.isEmpty()) {
            return 0;
        }
        int delivered = 0;
        for (SseEmitter emitter : emitters) {
            try {
                emitter.send(SseEmitter.event()
                        .id(message.getEventId())
                        .name(EVENT_NAME)
                        .data(message));
                delivered++;
            } catch (IOException | IllegalStateException e) {
                log.debug("Dropping closed {} subscriber: {}", table, e.getMessage());
                emitters.remove(emitter);
                emitter.completeWithError(e);
            }
        }
        return delivered;
    }
}
