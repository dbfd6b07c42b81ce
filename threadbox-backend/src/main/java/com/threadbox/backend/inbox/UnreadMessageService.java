package com.threadbox.backend.inbox;

import com.threadbox.backend.inbox.dto.InboxMessageDto;
import com.threadbox.backend.message.MessageMapper;
import com.threadbox.backend.message.MessageRepository;
import com.threadbox.backend.user.User;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Unread views of a user's received messages. Each method issues exactly one
 * SQL statement, row mapping included: every field the mapper reads is
 * fetched by the query that loads the rows.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class UnreadMessageService {

    private final MessageRepository messageRepository;

    /** Unread messages, newest first, with sender and parent preview. */
    public List<InboxMessageDto> unreadFor(User user) {
        return messageRepository.findUnreadWithSenderAndParent(user.getId()).stream()
                .map(m -> MessageMapper.toInboxDto(m, false))
                .toList();
    }

    /** Like {@link #unreadFor(User)}, also naming who wrote each parent message. */
    public List<InboxMessageDto> inbox(User user) {
        return messageRepository.findInbox(user.getId()).stream()
                .map(m -> MessageMapper.toInboxDto(m, true))
                .toList();
    }

    public long unreadCount(User user) {
        return messageRepository.countUnread(user.getId());
    }

    /** Unread messages that start a thread. */
    public List<InboxMessageDto> unreadThreadRoots(User user) {
        return messageRepository.findUnreadThreadRoots(user.getId()).stream()
                .map(m -> MessageMapper.toInboxDto(m, false))
                .toList();
    }
}
