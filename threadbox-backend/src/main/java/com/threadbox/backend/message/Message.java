package com.threadbox.backend.message;

import com.threadbox.backend.user.User;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
        name = "messages",
        indexes = {
                @Index(name = "idx_messages_receiver_read_sent", columnList = "receiver_id,is_read,sent_at"),
                @Index(name = "idx_messages_parent", columnList = "parent_message_id"),
                @Index(name = "idx_messages_sender_sent", columnList = "sender_id,sent_at")
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Message {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "sender_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private User sender;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "receiver_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private User receiver;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String content;

    // Fixed at creation; a reply never moves to another thread.
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "parent_message_id", updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Message parentMessage;

    // Read-only mirror of the parent FK so callers can use the id without touching the proxy.
    @Column(name = "parent_message_id", insertable = false, updatable = false)
    private UUID parentMessageId;

    @Column(name = "sent_at", nullable = false)
    private Instant sentAt;

    @Builder.Default
    @Column(name = "is_read", nullable = false)
    private boolean read = false;

    @Builder.Default
    @Column(nullable = false)
    private boolean edited = false;

    @Builder.Default
    @Column(nullable = false)
    private int editCount = 0;

    @CreationTimestamp
    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    private Instant updatedAt;

    public boolean isReply() {
        return parentMessageId != null;
    }

    public boolean isThreadStarter() {
        return parentMessageId == null;
    }

    public boolean isParticipant(User user) {
        return user != null && user.getId() != null
                && (user.getId().equals(senderId()) || user.getId().equals(receiverId()));
    }

    public Long senderId() {
        return sender != null ? sender.getId() : null;
    }

    public Long receiverId() {
        return receiver != null ? receiver.getId() : null;
    }
}
