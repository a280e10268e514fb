package org.example.restaurantfieldservice.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    /**
     * Time source for SLA deadlines, history timestamps and command projections.
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
