package com.threadbox.backend.history;

import com.threadbox.backend.history.dto.MessageHistoryDto;
import com.threadbox.backend.message.Message;
import com.threadbox.backend.message.MessageMapper;
import com.threadbox.backend.message.MessageRepository;
import com.threadbox.backend.shared.TextPreview;
import com.threadbox.backend.shared.error.NotFoundException;
import com.threadbox.backend.shared.error.PermissionDeniedException;
import com.threadbox.backend.user.User;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Audit log of message edits. Insert-only: there is no API to change or
 * remove a single entry.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MessageHistoryService {

    private final MessageHistoryRepository historyRepository;
    private final MessageRepository messageRepository;

    @Transactional
    public MessageHistory recordEdit(Message message, String oldContent, String newContent, User editor, String reason) {
        MessageHistory entry = MessageHistory.builder()
                .message(message)
                .oldContent(oldContent)
                .newContent(newContent)
                .editReason(reason)
                .editedBy(editor)
                .build();
        MessageHistory saved = historyRepository.save(entry);
        log.debug("Recorded edit of message {} by user {}", message.getId(), editor.getId());
        return saved;
    }

    public String summarize(MessageHistory entry) {
        return summarize(entry.getOldContent(), entry.getNewContent());
    }

    public static String summarize(String oldContent, String newContent) {
        int oldLength = TextPreview.length(oldContent);
        int newLength = TextPreview.length(newContent);
        if (newLength > oldLength) {
            return "Content expanded by " + (newLength - oldLength) + " characters";
        }
        if (newLength < oldLength) {
            return "Content shortened by " + (oldLength - newLength) + " characters";
        }
        return "Content length unchanged";
    }

    @Transactional(readOnly = true)
    public List<MessageHistoryDto> historyFor(UUID messageId, User viewer) {
        Message message = messageRepository.findDetailedById(messageId)
                .orElseThrow(() -> new NotFoundException("Message not found: " + messageId));
        if (!message.isParticipant(viewer)) {
            throw new PermissionDeniedException("Not a participant of this message");
        }
        return historyRepository.findByMessageWithEditor(messageId).stream()
                .map(this::toDto)
                .toList();
    }

    public MessageHistoryDto toDto(MessageHistory h) {
        return new MessageHistoryDto(
                h.getId(),
                h.getOldContent(),
                h.getNewContent(),
                h.getEditReason(),
                MessageMapper.toSummary(h.getEditedBy()),
                h.getEditedAt(),
                summarize(h),
                h.isContentChanged()
        );
    }
}
