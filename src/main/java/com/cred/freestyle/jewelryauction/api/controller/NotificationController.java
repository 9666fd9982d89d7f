package com.cred.freestyle.jewelryauction.api.controller;

import com.cred.freestyle.jewelryauction.api.dto.NotificationResponse;
import com.cred.freestyle.jewelryauction.api.dto.PageResponse;
import com.cred.freestyle.jewelryauction.domain.model.Notification.NotificationStatus;
import com.cred.freestyle.jewelryauction.service.NotificationService;
import com.cred.freestyle.jewelryauction.security.SecurityUtils;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST controller for the caller's notification inbox.
 *
 * @author Jewelry Auction Team
 */
@RestController
@RequestMapping("/api/v1/notifications")
@PreAuthorize("isAuthenticated()")
public class NotificationController {

    private final NotificationService notificationService;

    public NotificationController(NotificationService notificationService) {
        this.notificationService = notificationService;
    }

    @GetMapping
    public ResponseEntity<PageResponse<NotificationResponse>> list(
            @RequestParam(required = false) NotificationStatus status,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer size
    ) {
        return ResponseEntity.ok(PageResponse.from(
                notificationService.list(SecurityUtils.currentActor(), status, page, size),
                NotificationResponse::fromEntity));
    }

    @GetMapping("/unread-count")
    public ResponseEntity<Map<String, Long>> unreadCount() {
        return ResponseEntity.ok(Map.of("unread", notificationService.unreadCount(SecurityUtils.currentActor())));
    }

    @PostMapping("/{notificationId}/read")
    public ResponseEntity<NotificationResponse> markRead(@PathVariable String notificationId) {
        return ResponseEntity.ok(NotificationResponse.fromEntity(
                notificationService.markRead(notificationId, SecurityUtils.currentActor())));
    }

    @PostMapping("/read-all")
    public ResponseEntity<Map<String, Integer>> markAllRead() {
        return ResponseEntity.ok(Map.of("updated", notificationService.markAllRead(SecurityUtils.currentActor())));
    }
}
