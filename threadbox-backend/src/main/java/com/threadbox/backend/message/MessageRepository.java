package com.threadbox.backend.message;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface MessageRepository extends JpaRepository<Message, UUID> {

    // --- Single message ---

    @Query("""
        select m from Message m
        join fetch m.sender
        join fetch m.receiver
        left join fetch m.parentMessage
        where m.id = :id
    """)
    Optional<Message> findDetailedById(@Param("id") UUID id);

    // --- Thread expansion: one query per tree level ---

    @Query("""
        select m from Message m
        join fetch m.sender
        join fetch m.receiver
        where m.parentMessageId in :parentIds
        order by m.sentAt asc
    """)
    List<Message> findRepliesToAny(@Param("parentIds") Collection<UUID> parentIds);

    @Query("""
        select m from Message m
        join fetch m.sender
        join fetch m.receiver
        where m.parentMessageId = :parentId
        order by m.sentAt asc
    """)
    List<Message> findDirectReplies(@Param("parentId") UUID parentId);

    @Query("""
        select m.id as id, m.parentMessageId as parentId
        from Message m
        where m.parentMessageId in :parentIds
    """)
    List<MessageLink> findLinksByParentIdIn(@Param("parentIds") Collection<UUID> parentIds);

    @Query("""
        select m.id as id, m.parentMessageId as parentId
        from Message m
        where m.sender.id = :userId or m.receiver.id = :userId
    """)
    List<MessageLink> findLinksByParticipant(@Param("userId") Long userId);

    // --- Unread index: each read is a single statement ---

    @Query("""
        select m from Message m
        join fetch m.sender
        left join fetch m.parentMessage
        where m.receiver.id = :receiverId and m.read = false
        order by m.sentAt desc
    """)
    List<Message> findUnreadWithSenderAndParent(@Param("receiverId") Long receiverId);

    @Query("""
        select m from Message m
        join fetch m.sender
        left join fetch m.parentMessage p
        left join fetch p.sender
        where m.receiver.id = :receiverId and m.read = false
        order by m.sentAt desc
    """)
    List<Message> findInbox(@Param("receiverId") Long receiverId);

    @Query("""
        select count(m) from Message m
        where m.receiver.id = :receiverId and m.read = false
    """)
    long countUnread(@Param("receiverId") Long receiverId);

    @Query("""
        select m from Message m
        join fetch m.sender
        where m.receiver.id = :receiverId and m.read = false and m.parentMessageId is null
        order by m.sentAt desc
    """)
    List<Message> findUnreadThreadRoots(@Param("receiverId") Long receiverId);

    @Query("""
        select m.id from Message m
        where m.receiver.id = :receiverId and m.read = false
    """)
    List<UUID> findUnreadIds(@Param("receiverId") Long receiverId);

    // --- Listings ---

    // conversation (A <-> B), ascending by time
    @Query("""
        select m from Message m
        join fetch m.sender
        join fetch m.receiver
        where (m.sender.id = :a and m.receiver.id = :b)
           or (m.sender.id = :b and m.receiver.id = :a)
        order by m.sentAt asc
    """)
    List<Message> findConversation(@Param("a") Long userA, @Param("b") Long userB);

    @Query("""
        select m from Message m
        join fetch m.sender
        join fetch m.receiver
        where m.sender.id = :senderId
        order by m.sentAt desc
    """)
    List<Message> findSentBy(@Param("senderId") Long senderId);

    long countBySender_Id(Long senderId);

    long countByReceiver_Id(Long receiverId);

    // --- Bulk writes ---

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Message m set m.read = true, m.updatedAt = :now where m.id in :ids and m.read = false")
    int markReadByIdIn(@Param("ids") Collection<UUID> ids, @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from Message m where m.id in :ids")
    int deleteByIdIn(@Param("ids") Collection<UUID> ids);
}
