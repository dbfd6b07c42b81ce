package com.threadbox.backend.notification;

import com.threadbox.backend.message.Message;
import com.threadbox.backend.user.User;
import jakarta.persistence.*;
import lombok.Data;
import lombok.ToString;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;

@Entity
@Data
@ToString(exclude = {"recipient", "message"})
@Table(
        name = "notifications",
        indexes = {
                @Index(name = "idx_notifications_recipient_created", columnList = "recipient_id,created_at"),
                @Index(name = "idx_notifications_recipient_read", columnList = "recipient_id,is_read"),
                @Index(name = "idx_notifications_message", columnList = "message_id")
        }
)
public class Notification {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "recipient_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private User recipient;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "message_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Message message;

    @Column(nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private NotificationType type; // NEW_MESSAGE, EDIT, SYSTEM

    @Column(nullable = false)
    private String title;   // short headline like "New message from alice"

    @Column(columnDefinition = "TEXT")
    private String body;    // sender label plus a preview of the content

    @Column(name = "is_read", nullable = false)
    private boolean read = false;
    private Instant readAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();
    private Instant updatedAt;
}
