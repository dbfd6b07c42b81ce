package com.threadbox.backend.message;

import com.threadbox.backend.message.dto.MessageDto;
import com.threadbox.backend.message.event.*;
import com.threadbox.backend.shared.IdBatches;
import com.threadbox.backend.shared.error.InvalidParentException;
import com.threadbox.backend.shared.error.NotFoundException;
import com.threadbox.backend.shared.error.PermissionDeniedException;
import com.threadbox.backend.shared.error.ValidationException;
import com.threadbox.backend.thread.SubtreeLevels;
import com.threadbox.backend.thread.ThreadService;
import com.threadbox.backend.user.User;
import com.threadbox.backend.user.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Owns every write to {@link Message}. Each write and the lifecycle hooks it
 * triggers run in one transaction: audit rows and notifications commit or
 * roll back together with the message change.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MessageService {

    private final MessageRepository messageRepository;
    private final UserRepository userRepository;
    private final ThreadService threadService;
    private final MessageLifecycleHooks hooks;

    @Transactional
    public Message create(User sender, Long receiverId, String content, UUID parentId) {
        if (content == null || content.isBlank()) {
            throw new ValidationException("Message content must not be blank");
        }
        User receiver = userRepository.findById(receiverId)
                .orElseThrow(() -> new NotFoundException("Receiver not found: " + receiverId));

        Message parent = null;
        if (parentId != null) {
            parent = messageRepository.findById(parentId)
                    .orElseThrow(() -> new InvalidParentException(parentId));
            if (!threadService.canReply(parent, sender)) {
                throw new PermissionDeniedException("You don't have permission to reply to this message");
            }
        }

        Message message = Message.builder()
                .sender(sender)
                .receiver(receiver)
                .content(content)
                .parentMessage(parent)
                .parentMessageId(parentId)
                .sentAt(Instant.now())
                .build();
        Message saved = messageRepository.save(message);
        log.info("Message {} sent by user {} to user {}{}", saved.getId(), sender.getId(), receiverId,
                parentId != null ? " (reply to " + parentId + ")" : "");

        hooks.created(new MessageCreatedEvent(saved));
        return saved;
    }

    /**
     * Replaces the content when it differs from the stored one. An identical
     * content is a no-op: no audit row, no notification, no counter change.
     */
    @Transactional
    public Message edit(UUID messageId, User editor, String newContent, String reason) {
        Message message = loadDetailed(messageId);
        if (!editor.getId().equals(message.senderId())) {
            throw new PermissionDeniedException("Only the sender can edit this message");
        }
        if (newContent == null || newContent.isBlank()) {
            throw new ValidationException("Message content must not be blank");
        }

        String oldContent = message.getContent();
        if (oldContent.equals(newContent)) {
            log.debug("Edit of message {} left content unchanged", messageId);
            return message;
        }

        message.setContent(newContent);
        message.setEdited(true);
        message.setEditCount(message.getEditCount() + 1);
        messageRepository.save(message);
        log.info("Message {} edited by user {} (edit #{})", messageId, editor.getId(), message.getEditCount());

        hooks.edited(new MessageEditedEvent(message, oldContent, newContent, editor, reason));
        return message;
    }

    @Transactional
    public Message markRead(UUID messageId, User actor) {
        Message message = loadDetailed(messageId);
        if (!actor.getId().equals(message.receiverId())) {
            throw new PermissionDeniedException("Only the receiver can mark this message as read");
        }
        if (message.isRead()) {
            return message;
        }

        message.setRead(true);
        messageRepository.save(message);
        hooks.read(new MessagesReadEvent(message.receiverId(), List.of(message.getId())));
        return message;
    }

    /**
     * @return number of messages that went from unread to read
     */
    @Transactional
    public int markAllRead(User receiver) {
        List<UUID> unread = messageRepository.findUnreadIds(receiver.getId());
        if (unread.isEmpty()) return 0;

        Instant now = Instant.now();
        int updated = 0;
        for (List<UUID> batch : IdBatches.of(unread)) {
            updated += messageRepository.markReadByIdIn(batch, now);
            hooks.read(new MessagesReadEvent(receiver.getId(), batch));
        }
        log.info("Marked {} message(s) read for user {}", updated, receiver.getId());
        return updated;
    }

    /**
     * Deletes the message and its whole reply subtree.
     *
     * @return number of messages removed
     */
    @Transactional
    public int delete(UUID messageId, User actor) {
        Message message = messageRepository.findById(messageId)
                .orElseThrow(() -> new NotFoundException("Message not found: " + messageId));
        if (!actor.getId().equals(message.senderId())) {
            throw new PermissionDeniedException("Only the sender can delete this message");
        }
        int deleted = deleteSubtrees(List.of(messageId));
        log.info("Message {} deleted by user {} ({} message(s) removed with replies)", messageId, actor.getId(), deleted);
        return deleted;
    }

    /**
     * Removes the given messages with all their replies. Dependents are cleared by
     * the deleting hook first, then messages go level by level, replies before parents.
     * Hooks and deletes receive the ids in batches of at most {@link IdBatches#SIZE}.
     */
    @Transactional
    public int deleteSubtrees(Collection<UUID> seedIds) {
        SubtreeLevels levels = threadService.subtreeLevels(seedIds);
        if (levels.isEmpty()) return 0;

        for (List<UUID> batch : IdBatches.of(levels.ids())) {
            hooks.deleting(new MessagesDeletingEvent(batch));
        }
        int deleted = 0;
        for (List<UUID> level : levels.deepestFirst()) {
            for (List<UUID> batch : IdBatches.of(level)) {
                deleted += messageRepository.deleteByIdIn(batch);
            }
        }
        return deleted;
    }

    // --- Reads ---

    @Transactional(readOnly = true)
    public MessageDto get(UUID messageId, User viewer) {
        Message message = loadDetailed(messageId);
        if (!message.isParticipant(viewer)) {
            throw new PermissionDeniedException("Not a participant of this message");
        }
        return MessageMapper.toDto(message);
    }

    @Transactional(readOnly = true)
    public List<MessageDto> conversation(User user, Long partnerId) {
        if (!userRepository.existsById(partnerId)) {
            throw new NotFoundException("User not found: " + partnerId);
        }
        return messageRepository.findConversation(user.getId(), partnerId).stream()
                .map(MessageMapper::toDto)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<MessageDto> sentBy(User user) {
        return messageRepository.findSentBy(user.getId()).stream()
                .map(MessageMapper::toDto)
                .toList();
    }

    private Message loadDetailed(UUID messageId) {
        return messageRepository.findDetailedById(messageId)
                .orElseThrow(() -> new NotFoundException("Message not found: " + messageId));
    }
}
