package com.threadbox.backend.notification;

import com.threadbox.backend.notification.dto.NotificationDto;
import com.threadbox.backend.user.CurrentUserService;
import com.threadbox.backend.user.User;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/notifications")
@RequiredArgsConstructor
public class NotificationController {

    private final NotificationService service;
    private final CurrentUserService currentUserService;

    /**
     * Fetch unread notifications with pagination.
     * Defaults: page=0, size=20
     */
    @GetMapping("/unread")
    public Page<NotificationDto> getUnread(
            @RequestHeader(value = CurrentUserService.USER_HEADER, required = false) Long userId,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size
    ) {
        User user = currentUserService.getCurrentUserOrThrow(userId);
        return service.getUnread(user, PageRequest.of(page, size));
    }

    /**
     * Fetch all notifications with pagination.
     * Defaults: page=0, size=20
     */
    @GetMapping("/all")
    public Page<NotificationDto> getAll(
            @RequestHeader(value = CurrentUserService.USER_HEADER, required = false) Long userId,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size
    ) {
        User user = currentUserService.getCurrentUserOrThrow(userId);
        return service.getAll(user, PageRequest.of(page, size));
    }

    @GetMapping("/unread/count")
    public Map<String, Long> unreadCount(
            @RequestHeader(value = CurrentUserService.USER_HEADER, required = false) Long userId
    ) {
        User user = currentUserService.getCurrentUserOrThrow(userId);
        return Map.of("unreadCount", service.countUnread(user));
    }

    /**
     * Mark a single notification as read.
     */
    @PostMapping("/{id}/read")
    public ResponseEntity<Void> markAsRead(
            @PathVariable Long id,
            @RequestHeader(value = CurrentUserService.USER_HEADER, required = false) Long userId
    ) {
        User user = currentUserService.getCurrentUserOrThrow(userId);
        service.markAsRead(id, user);
        return ResponseEntity.ok().build();
    }

    /**
     * Mark all notifications as read.
     */
    @PostMapping("/read-all")
    public Map<String, Integer> markAllAsRead(
            @RequestHeader(value = CurrentUserService.USER_HEADER, required = false) Long userId
    ) {
        User user = currentUserService.getCurrentUserOrThrow(userId);
        return Map.of("updated", service.markAllAsRead(user));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteNotification(
            @PathVariable Long id,
            @RequestHeader(value = CurrentUserService.USER_HEADER, required = false) Long userId
    ) {
        User user = currentUserService.getCurrentUserOrThrow(userId);
        service.delete(id, user);
        return ResponseEntity.noContent().build();
    }
}
