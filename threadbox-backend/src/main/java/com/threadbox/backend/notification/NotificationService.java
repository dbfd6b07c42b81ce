package com.threadbox.backend.notification;

import com.threadbox.backend.message.Message;
import com.threadbox.backend.notification.dto.NotificationDto;
import com.threadbox.backend.shared.error.NotFoundException;
import com.threadbox.backend.shared.error.PermissionDeniedException;
import com.threadbox.backend.user.User;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

@Service
@RequiredArgsConstructor
public class NotificationService {

    private final NotificationRepository repository;

    /**
     * Create a notification about a message.
     */
    @Transactional
    public Notification create(
            User recipient,
            Message message,
            NotificationType type,
            String title,
            String body
    ) {
        Notification n = new Notification();
        n.setRecipient(recipient);
        n.setMessage(message);
        n.setType(type);
        n.setTitle(title);
        n.setBody(body);
        n.setRead(false);
        n.setCreatedAt(Instant.now());
        return repository.save(n);
    }

    /**
     * Fetch unread notifications for a user with pagination.
     */
    @Transactional(readOnly = true)
    public Page<NotificationDto> getUnread(User recipient, Pageable pageable) {
        return repository.findByRecipient_IdAndReadFalseOrderByCreatedAtDesc(recipient.getId(), pageable)
                .map(this::toDto);
    }

    /**
     * Fetch all notifications for a user with pagination.
     */
    @Transactional(readOnly = true)
    public Page<NotificationDto> getAll(User recipient, Pageable pageable) {
        return repository.findByRecipient_IdOrderByCreatedAtDesc(recipient.getId(), pageable)
                .map(this::toDto);
    }

    @Transactional(readOnly = true)
    public long countUnread(User recipient) {
        return repository.countByRecipient_IdAndReadFalse(recipient.getId());
    }

    /**
     * Mark a single notification as read.
     */
    @Transactional
    public void markAsRead(Long notificationId, User recipient) {
        Notification n = findOwned(notificationId, recipient);
        if (n.isRead()) return;
        n.setRead(true);
        n.setReadAt(Instant.now());
        n.setUpdatedAt(n.getReadAt());
        repository.save(n);
    }

    /**
     * Mark all notifications as read for a user.
     */
    @Transactional
    public int markAllAsRead(User recipient) {
        return repository.markAllReadForRecipient(recipient.getId(), Instant.now());
    }

    @Transactional
    public void delete(Long id, User recipient) {
        repository.delete(findOwned(id, recipient));
    }

    public NotificationDto toDto(Notification n) {
        if (n == null) return null;
        Message message = n.getMessage();
        return new NotificationDto(
                n.getId(),
                n.getType(),
                n.getTitle(),
                n.getBody(),
                n.isRead(),
                n.getCreatedAt(),
                message != null ? message.getId() : null,
                message != null && message.getSender() != null ? message.getSender().getUsername() : null
        );
    }

    private Notification findOwned(Long notificationId, User recipient) {
        Notification n = repository.findById(notificationId)
                .orElseThrow(() -> new NotFoundException("Notification not found: " + notificationId));
        if (!n.getRecipient().getId().equals(recipient.getId())) {
            throw new PermissionDeniedException("Not your notification");
        }
        return n;
    }
}
