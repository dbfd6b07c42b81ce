package com.threadbox.backend.notification.dto;

import com.threadbox.backend.notification.NotificationType;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

@Data
@AllArgsConstructor
public class NotificationDto {
    private Long id;
    private NotificationType type;
    private String title;
    private String body;
    private boolean read;
    private Instant createdAt;
    private UUID messageId;
    private String senderUsername;   // sender of the referenced message
}
