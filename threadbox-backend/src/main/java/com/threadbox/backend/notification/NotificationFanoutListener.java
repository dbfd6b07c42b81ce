package com.threadbox.backend.notification;

import com.threadbox.backend.message.Message;
import com.threadbox.backend.message.event.MessageCreatedEvent;
import com.threadbox.backend.message.event.MessageEditedEvent;
import com.threadbox.backend.message.event.MessageLifecycleListener;
import com.threadbox.backend.message.event.MessagesDeletingEvent;
import com.threadbox.backend.message.event.MessagesReadEvent;
import com.threadbox.backend.shared.TextPreview;
import com.threadbox.backend.user.User;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Turns message lifecycle transitions into notifications for the receiver.
 */
@Slf4j
@Component
@Order(20)
public class NotificationFanoutListener implements MessageLifecycleListener {

    private final NotificationService notificationService;
    private final NotificationRepository notificationRepository;
    private final int previewLength;

    public NotificationFanoutListener(
            NotificationService notificationService,
            NotificationRepository notificationRepository,
            @Value("${threadbox.messaging.preview-length:100}") int previewLength
    ) {
        this.notificationService = notificationService;
        this.notificationRepository = notificationRepository;
        this.previewLength = previewLength;
    }

    @Override
    public void onCreated(MessageCreatedEvent event) {
        Message message = event.message();
        User sender = message.getSender();
        Notification n = notificationService.create(
                message.getReceiver(),
                message,
                NotificationType.NEW_MESSAGE,
                "New message from " + sender.getUsername(),
                sender.label() + " sent you a message: \"" + TextPreview.of(message.getContent(), previewLength) + "\""
        );
        log.info("Notification created: {} for user {}", n.getTitle(), message.receiverId());
    }

    @Override
    public void onEdited(MessageEditedEvent event) {
        Message message = event.message();
        User editor = event.editor();
        notificationService.create(
                message.getReceiver(),
                message,
                NotificationType.EDIT,
                "Message edited by " + editor.getUsername(),
                editor.label() + " edited a message: \"" + TextPreview.of(event.newContent(), previewLength) + "\""
        );
    }

    @Override
    public void onRead(MessagesReadEvent event) {
        int updated = notificationRepository.markReadForMessages(event.messageIds(), event.receiverId(), Instant.now());
        log.debug("Notifications marked as read for {} message(s): {}", event.messageIds().size(), updated);
    }

    @Override
    public void onDeleting(MessagesDeletingEvent event) {
        notificationRepository.deleteByMessageIdIn(event.messageIds());
    }
}
