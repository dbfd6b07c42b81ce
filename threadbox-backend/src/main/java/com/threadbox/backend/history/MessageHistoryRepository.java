package com.threadbox.backend.history;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface MessageHistoryRepository extends JpaRepository<MessageHistory, Long> {

    @Query("""
        select h from MessageHistory h
        join fetch h.editedBy
        where h.message.id = :messageId
        order by h.editedAt desc, h.id desc
    """)
    List<MessageHistory> findByMessageWithEditor(@Param("messageId") UUID messageId);

    long countByMessage_Id(UUID messageId);

    long countByEditedBy_Id(Long editorId);

    @Query("select count(h) from MessageHistory h where h.message.receiver.id = :receiverId")
    long countOnMessagesReceivedBy(@Param("receiverId") Long receiverId);

    @Modifying(flushAutomatically = true)
    @Query("delete from MessageHistory h where h.message.id in :messageIds")
    int deleteByMessageIdIn(@Param("messageIds") Collection<UUID> messageIds);

    @Modifying(flushAutomatically = true)
    @Query("delete from MessageHistory h where h.editedBy.id = :editorId")
    int deleteByEditorId(@Param("editorId") Long editorId);
}
