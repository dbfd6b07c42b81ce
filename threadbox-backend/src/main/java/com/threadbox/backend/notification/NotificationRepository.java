package com.threadbox.backend.notification;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface NotificationRepository extends JpaRepository<Notification, Long> {

    // Fetch unread notifications with pagination
    @EntityGraph(attributePaths = {"message", "message.sender"})
    Page<Notification> findByRecipient_IdAndReadFalseOrderByCreatedAtDesc(Long recipientId, Pageable pageable);

    // Fetch all notifications with pagination
    @EntityGraph(attributePaths = {"message", "message.sender"})
    Page<Notification> findByRecipient_IdOrderByCreatedAtDesc(Long recipientId, Pageable pageable);

    long countByRecipient_IdAndReadFalse(Long recipientId);

    List<Notification> findByMessage_IdOrderByCreatedAtAsc(UUID messageId);

    long countByRecipient_Id(Long recipientId);

    /**
     * Propagates a message read transition to the receiver's notifications of those messages.
     */
    @Modifying(flushAutomatically = true)
    @Query("""
        update Notification n
        set n.read = true, n.readAt = :now, n.updatedAt = :now
        where n.message.id in :messageIds
          and n.recipient.id = :recipientId
          and n.read = false
    """)
    int markReadForMessages(@Param("messageIds") Collection<UUID> messageIds,
                            @Param("recipientId") Long recipientId,
                            @Param("now") Instant now);

    @Modifying(flushAutomatically = true)
    @Query("""
        update Notification n
        set n.read = true, n.readAt = :now, n.updatedAt = :now
        where n.recipient.id = :recipientId and n.read = false
    """)
    int markAllReadForRecipient(@Param("recipientId") Long recipientId, @Param("now") Instant now);

    @Modifying(flushAutomatically = true)
    @Query("delete from Notification n where n.message.id in :messageIds")
    int deleteByMessageIdIn(@Param("messageIds") Collection<UUID> messageIds);

    @Modifying(flushAutomatically = true)
    @Query("delete from Notification n where n.recipient.id = :recipientId")
    int deleteAllByRecipient_Id(@Param("recipientId") Long recipientId);
}
