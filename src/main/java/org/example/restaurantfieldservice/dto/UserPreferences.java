package org.example.restaurantfieldservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Display preferences stored per user as a JSON blob.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserPreferences {

    @Builder.Default
    private boolean notificationsEnabled = true;

    @Builder.Default
    private boolean darkMode = false;

    @Builder.Default
    private String language = "en";

    public static UserPreferences defaults() {
        return UserPreferences.builder().build();
    }
}
