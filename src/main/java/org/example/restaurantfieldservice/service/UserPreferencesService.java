package org.example.restaurantfieldservice.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.restaurantfieldservice.dto.UserPreferences;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

/**
 * Per-user display preferences, stored as a JSON blob under {@code prefs:{userId}}.
 * A missing or unreadable blob yields the defaults.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserPreferencesService {

    private static final String PREFS_PREFIX = "prefs:";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    public UserPreferences getPreferences(Long userId) {
        try {
            String json = redisTemplate.opsForValue().get(PREFS_PREFIX + userId);
            if (json == null) {
                return UserPreferences.defaults();
            }
            return objectMapper.readValue(json, UserPreferences.class);
        } catch (JsonProcessingException e) {
            log.warn("⚠️ Unreadable preferences for user {}, using defaults: {}", userId, e.getOriginalMessage());
            return UserPreferences.defaults();
        } catch (Exception e) {
            log.warn("⚠️ REDIS ERROR - Error reading preferences for user {}: {}", userId, e.getMessage());
            return UserPreferences.defaults();
        }
    }

    /**
     * @throws IllegalStateException if the preferences could not be stored
     */
    public UserPreferences savePreferences(Long userId, UserPreferences preferences) {
        try {
            redisTemplate.opsForValue().set(PREFS_PREFIX + userId, objectMapper.writeValueAsString(preferences));
            log.debug("Saved preferences for user {}", userId);
            return preferences;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Preferences could not be serialized: " + e.getOriginalMessage(), e);
        } catch (Exception e) {
            log.error("❌ REDIS ERROR - Error saving preferences for user {}: {}", userId, e.getMessage());
            throw new IllegalStateException("Preferences could not be saved", e);
        }
    }
}
