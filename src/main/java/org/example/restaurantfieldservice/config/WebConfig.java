package org.example.restaurantfieldservice.config;

import lombok.RequiredArgsConstructor;
import org.example.restaurantfieldservice.enums.DeviceStatus;
import org.example.restaurantfieldservice.enums.TicketPriority;
import org.example.restaurantfieldservice.enums.TicketStatus;
import org.example.restaurantfieldservice.enums.UserRole;
import org.example.restaurantfieldservice.web.SessionContextArgumentResolver;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.format.FormatterRegistry;
import org.springframework.util.StringUtils;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;
import java.util.function.Function;

@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

    private final SessionContextArgumentResolver sessionContextArgumentResolver;

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(sessionContextArgumentResolver);
    }

    /**
     * Query parameters accept the same lowercase values as the JSON bodies ("in-progress", "high").
     */
    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(String.class, TicketStatus.class, wireValue(TicketStatus::fromValue));
        registry.addConverter(String.class, TicketPriority.class, wireValue(TicketPriority::fromValue));
        registry.addConverter(String.class, DeviceStatus.class, wireValue(DeviceStatus::fromValue));
        registry.addConverter(String.class, UserRole.class, wireValue(UserRole::fromValue));
    }

    private static <T> Converter<String, T> wireValue(Function<String, T> fromValue) {
        return source -> StringUtils.hasText(source) ? fromValue.apply(source) : null;
    }
}
