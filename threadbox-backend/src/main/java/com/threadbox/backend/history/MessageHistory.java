package com.threadbox.backend.history;

import com.threadbox.backend.message.Message;
import com.threadbox.backend.user.User;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;

/**
 * One content change of a message. Rows are append-only; they disappear only
 * together with their message or their editor.
 */
@Entity
@Immutable
@Table(
        name = "message_history",
        indexes = {
                @Index(name = "idx_history_message_edited", columnList = "message_id,edited_at"),
                @Index(name = "idx_history_editor", columnList = "edited_by_id")
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MessageHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "message_id", nullable = false, updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Message message;

    @Column(nullable = false, updatable = false, columnDefinition = "TEXT")
    private String oldContent;

    @Column(nullable = false, updatable = false, columnDefinition = "TEXT")
    private String newContent;

    @Column(length = 255, updatable = false)
    private String editReason;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "edited_by_id", nullable = false, updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private User editedBy;

    @CreationTimestamp
    @Column(name = "edited_at", nullable = false, updatable = false)
    private Instant editedAt;

    public boolean isContentChanged() {
        return oldContent != null && !oldContent.equals(newContent);
    }
}
