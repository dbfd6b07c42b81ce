package com.threadbox.backend.thread;

import com.threadbox.backend.message.Message;
import com.threadbox.backend.message.MessageLink;
import com.threadbox.backend.message.MessageMapper;
import com.threadbox.backend.message.MessageRepository;
import com.threadbox.backend.message.dto.MessageDto;
import com.threadbox.backend.shared.IdBatches;
import com.threadbox.backend.shared.error.NotFoundException;
import com.threadbox.backend.shared.error.PermissionDeniedException;
import com.threadbox.backend.thread.dto.ThreadNodeDto;
import com.threadbox.backend.user.User;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;

/**
 * Read-side traversal of reply trees. Parent links are immutable and a parent
 * must exist before its replies, so the links always form a forest.
 * <p>
 * Descendants are collected level by level: one query per tree level (per
 * {@link IdBatches#SIZE} ids of that level), never one per message, and no recursion.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ThreadService {

    private final MessageRepository messageRepository;

    public Message rootOf(Message message) {
        Message current = message;
        while (current.getParentMessage() != null) {
            current = current.getParentMessage();
        }
        return current;
    }

    public int depthOf(Message message) {
        int depth = 0;
        Message current = message;
        while (current.getParentMessage() != null) {
            current = current.getParentMessage();
            depth++;
        }
        return depth;
    }

    /** Root first, then every level of the tree in order. */
    public List<Message> threadMessages(Message anyMessage) {
        Message root = rootOf(anyMessage);
        List<Message> thread = new ArrayList<>();
        thread.add(root);
        thread.addAll(descendantsOf(root));
        return thread;
    }

    public List<Message> allReplies(Message message) {
        return descendantsOf(message);
    }

    public List<Message> directReplies(Message message) {
        return messageRepository.findDirectReplies(message.getId());
    }

    public int replyCount(Message message) {
        return subtreeLevels(List.of(message.getId())).size() - 1;
    }

    /**
     * Participants of the message itself or of its thread root may reply.
     */
    public boolean canReply(Message message, User user) {
        if (message.isParticipant(user)) return true;
        return rootOf(message).isParticipant(user);
    }

    /**
     * Ids of the seeds and everything below them, with depths, walking id-only
     * links so no message rows are loaded.
     */
    public SubtreeLevels subtreeLevels(Collection<UUID> seedIds) {
        if (seedIds.isEmpty()) return SubtreeLevels.empty();

        Map<UUID, UUID> parentOf = new LinkedHashMap<>();
        for (UUID seed : seedIds) {
            parentOf.put(seed, null);
        }
        List<UUID> frontier = new ArrayList<>(parentOf.keySet());
        while (!frontier.isEmpty()) {
            List<UUID> next = new ArrayList<>();
            for (List<UUID> batch : IdBatches.of(frontier)) {
                for (MessageLink link : messageRepository.findLinksByParentIdIn(batch)) {
                    if (!parentOf.containsKey(link.getId())) {
                        next.add(link.getId());
                    }
                    parentOf.put(link.getId(), link.getParentId());
                }
            }
            frontier = next;
        }
        return SubtreeLevels.fromParentLinks(parentOf);
    }

    // --- Entry points used by the REST layer ---

    public ThreadNodeDto threadTree(UUID messageId, User viewer) {
        Message message = loadVisible(messageId, viewer);
        List<Message> thread = threadMessages(message);
        return buildTree(thread);
    }

    public List<MessageDto> allReplies(UUID messageId, User viewer) {
        Message message = loadVisible(messageId, viewer);
        return allReplies(message).stream().map(MessageMapper::toDto).toList();
    }

    public List<MessageDto> directReplies(UUID messageId, User viewer) {
        Message message = loadVisible(messageId, viewer);
        return directReplies(message).stream().map(MessageMapper::toDto).toList();
    }

    private Message loadVisible(UUID messageId, User viewer) {
        Message message = messageRepository.findDetailedById(messageId)
                .orElseThrow(() -> new NotFoundException("Message not found: " + messageId));
        if (!canReply(message, viewer)) {
            throw new PermissionDeniedException("Not a participant of this thread");
        }
        return message;
    }

    private List<Message> descendantsOf(Message message) {
        List<Message> descendants = new ArrayList<>();
        Set<UUID> seen = new HashSet<>();
        seen.add(message.getId());
        List<UUID> frontier = List.of(message.getId());
        while (!frontier.isEmpty()) {
            List<UUID> next = new ArrayList<>();
            for (List<UUID> batch : IdBatches.of(frontier)) {
                for (Message reply : messageRepository.findRepliesToAny(batch)) {
                    if (seen.add(reply.getId())) {
                        descendants.add(reply);
                        next.add(reply.getId());
                    }
                }
            }
            frontier = next;
        }
        return descendants;
    }

    // thread is root first, then level order, so every parent precedes its replies
    private ThreadNodeDto buildTree(List<Message> thread) {
        Map<UUID, ThreadNodeDto> nodes = new LinkedHashMap<>();
        ThreadNodeDto root = null;
        for (Message message : thread) {
            ThreadNodeDto node = toNode(message);
            ThreadNodeDto parent = node.getParentMessageId() != null ? nodes.get(node.getParentMessageId()) : null;
            if (parent == null) {
                root = node;
            } else {
                node.setDepth(parent.getDepth() + 1);
                parent.getReplies().add(node);
            }
            nodes.put(message.getId(), node);
        }

        List<ThreadNodeDto> ordered = new ArrayList<>(nodes.values());
        Collections.reverse(ordered);
        for (ThreadNodeDto node : ordered) {
            ThreadNodeDto parent = node.getParentMessageId() != null ? nodes.get(node.getParentMessageId()) : null;
            if (parent != null) {
                parent.setReplyCount(parent.getReplyCount() + 1 + node.getReplyCount());
            }
        }
        return root;
    }

    private ThreadNodeDto toNode(Message m) {
        return ThreadNodeDto.builder()
                .id(m.getId())
                .parentMessageId(m.getParentMessageId())
                .sender(MessageMapper.toSummary(m.getSender()))
                .receiver(MessageMapper.toSummary(m.getReceiver()))
                .content(m.getContent())
                .sentAt(m.getSentAt())
                .read(m.isRead())
                .edited(m.isEdited())
                .editCount(m.getEditCount())
                .depth(0)
                .replyCount(0)
                .build();
    }
}
