package org.example.restaurantfieldservice.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.restaurantfieldservice.session.SessionContext;
import org.example.restaurantfieldservice.stream.ChangeSubscriptionRegistry;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * GET /api/changes/{table} - server-sent {@code change} events for one table,
 * or every table with {@code *}.
 */
@Slf4j
@RestController
@RequestMapping("/api/changes")
@RequiredArgsConstructor
public class ChangeStreamController {

    private final ChangeSubscriptionRegistry subscriptionRegistry;

    @GetMapping(value = "/{table}", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter subscribe(@PathVariable String table, SessionContext session) {
        log.info("GET /api/changes/{} - user {}", table, session.getUserId());
        return subscriptionRegistry.subscribe(table);
    }
}
