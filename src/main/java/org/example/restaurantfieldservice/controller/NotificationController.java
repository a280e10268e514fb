package org.example.restaurantfieldservice.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.restaurantfieldservice.dto.NotificationDTO;
import org.example.restaurantfieldservice.dto.PagedResponse;
import org.example.restaurantfieldservice.service.NotificationService;
import org.example.restaurantfieldservice.session.SessionContext;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/notifications")
@RequiredArgsConstructor
public class NotificationController {

    private final NotificationService notificationService;

    @GetMapping
    public ResponseEntity<PagedResponse<NotificationDTO>> getNotifications(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size,
            SessionContext session) {
        return ResponseEntity.ok(notificationService.getNotifications(session, page, size));
    }

    @GetMapping("/unread-count")
    public ResponseEntity<Map<String, Long>> getUnreadCount(SessionContext session) {
        return ResponseEntity.ok(Map.of("unread", notificationService.getUnreadCount(session)));
    }

    @PatchMapping("/{id:\\d+}/read")
    public ResponseEntity<NotificationDTO> markRead(@PathVariable Long id, SessionContext session) {
        return ResponseEntity.ok(notificationService.markRead(id, session));
    }

    @PostMapping("/read-all")
    public ResponseEntity<Map<String, Integer>> markAllRead(SessionContext session) {
        int updated = notificationService.markAllRead(session);
        log.info("POST /api/notifications/read-all - {} marked for user {}", updated, session.getUserId());
        return ResponseEntity.ok(Map.of("updated", updated));
    }
}
