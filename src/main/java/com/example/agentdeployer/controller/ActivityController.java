package com.example.agentdeployer.controller;

import com.example.agentdeployer.domain.ActivityLog;
import com.example.agentdeployer.domain.Notification;
import com.example.agentdeployer.notification.NotificationService;
import com.example.agentdeployer.service.ActivityLogService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Activity trail and operator notifications.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ActivityController {

    private final ActivityLogService activityLogService;
    private final NotificationService notificationService;

    @GetMapping("/activity")
    public ResponseEntity<List<ActivityLog>> activity(@RequestParam(defaultValue = "50") int limit,
                                                      @RequestParam(required = false) String entityType,
                                                      @RequestParam(required = false) String entityId) {
        if (entityType != null && entityId != null) {
            return ResponseEntity.ok(activityLogService.getForEntity(entityType, entityId));
        }
        return ResponseEntity.ok(activityLogService.getRecent(limit));
    }

    @GetMapping("/notifications")
    public ResponseEntity<List<Notification>> notifications(@RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(notificationService.getRecent(limit));
    }

    @GetMapping("/notifications/unread-count")
    public ResponseEntity<Map<String, Long>> unreadCount() {
        return ResponseEntity.ok(Map.of("unread", notificationService.getUnreadCount()));
    }

    @PostMapping("/notifications/{id}/read")
    public ResponseEntity<Notification> markRead(@PathVariable String id) {
        return ResponseEntity.ok(notificationService.markRead(id));
    }

    @PostMapping("/notifications/read-all")
    public ResponseEntity<Map<String, Integer>> markAllRead() {
        return ResponseEntity.ok(Map.of("updated", notificationService.markAllRead()));
    }
}
