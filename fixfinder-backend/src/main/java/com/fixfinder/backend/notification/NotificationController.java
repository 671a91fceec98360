package com.fixfinder.backend.notification;

import com.fixfinder.backend.auth.CustomUserDetails;
import com.fixfinder.backend.notification.dto.NotificationDto;
import com.fixfinder.backend.notification.dto.NotificationPage;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/notifications")
@RequiredArgsConstructor
public class NotificationController {

    private final NotificationService service;

    /**
     * Active notifications, newest first. Defaults: page=1, limit=20.
     */
    @GetMapping
    public NotificationPage list(
            @AuthenticationPrincipal CustomUserDetails principal,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit,
            @RequestParam(defaultValue = "false") boolean unreadOnly
    ) {
        return service.list(principal.getUser().getId(), page, limit, unreadOnly);
    }

    @GetMapping("/count")
    public Map<String, Long> unreadCount(@AuthenticationPrincipal CustomUserDetails principal) {
        return Map.of("unreadCount", service.unreadCount(principal.getUser().getId()));
    }

    @PutMapping("/{id}/read")
    public NotificationDto markRead(
            @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails principal
    ) {
        return service.markRead(id, principal.getUser().getId());
    }

    @PutMapping("/read-all")
    public Map<String, Integer> markAllRead(@AuthenticationPrincipal CustomUserDetails principal) {
        return Map.of("modified", service.markAllRead(principal.getUser().getId()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(
            @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails principal
    ) {
        service.delete(id, principal.getUser().getId());
        return ResponseEntity.noContent().build();
    }
}
