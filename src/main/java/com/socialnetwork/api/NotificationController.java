package com.socialnetwork.api;

import com.socialnetwork.domain.model.NotificationPage;
import com.socialnetwork.domain.service.NotificationService;
import com.socialnetwork.infrastructure.security.SessionAuthInterceptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Notification inbox, polled by the client.
 */
@Slf4j
@RestController
@RequestMapping("/api/notifications")
@RequiredArgsConstructor
public class NotificationController {

    private final NotificationService notificationService;

    /**
     * GET /api/notifications?type=follow_request&limit=20&offset=0&mark_as_read=false
     */
    @GetMapping
    public ResponseEntity<NotificationPage> list(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @RequestParam(required = false) String type,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset,
            @RequestParam(name = "mark_as_read", defaultValue = "false") boolean markAsRead) {
        return ResponseEntity.ok(notificationService.list(userId, type, limit, offset, markAsRead));
    }

    @GetMapping("/unread")
    public ResponseEntity<Map<String, Long>> unreadCount(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId) {
        return ResponseEntity.ok(Map.of("unread_count", notificationService.unreadCount(userId)));
    }

    @PostMapping("/{id}/read")
    public ResponseEntity<Map<String, String>> markRead(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long id) {
        notificationService.markRead(id, userId);
        return ResponseEntity.ok(Map.of("message", "Notification marked as read"));
    }

    @PostMapping("/read-all")
    public ResponseEntity<Map<String, Object>> markAllRead(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId) {
        int updated = notificationService.markAllRead(userId);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "All notifications marked as read");
        body.put("updated", updated);
        return ResponseEntity.ok(body);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, String>> delete(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long id) {
        notificationService.delete(id, userId);
        return ResponseEntity.ok(Map.of("message", "Notification deleted"));
    }

    @DeleteMapping
    public ResponseEntity<Map<String, Object>> deleteAll(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId) {
        int deleted = notificationService.deleteAll(userId);
        log.info("Notifications cleared: userId={}, deleted={}", userId, deleted);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "All notifications deleted");
        body.put("deleted", deleted);
        return ResponseEntity.ok(body);
    }
}
