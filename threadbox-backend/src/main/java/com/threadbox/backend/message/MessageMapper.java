package com.threadbox.backend.message;

import com.threadbox.backend.inbox.dto.InboxMessageDto;
import com.threadbox.backend.message.dto.MessageDto;
import com.threadbox.backend.message.dto.ParentPreviewDto;
import com.threadbox.backend.shared.TextPreview;
import com.threadbox.backend.user.User;
import com.threadbox.backend.user.dto.UserSummaryDto;

public final class MessageMapper {
    private MessageMapper() {}

    public static final int PARENT_PREVIEW_CHARS = 100;

    // Touches sender and receiver; load them with the message.
    public static MessageDto toDto(Message m) {
        return new MessageDto(
                m.getId(),
                toSummary(m.getSender()),
                toSummary(m.getReceiver()),
                m.getContent(),
                m.getParentMessageId(),
                m.getSentAt(),
                m.isRead(),
                m.isEdited(),
                m.getEditCount(),
                m.isReply(),
                m.isThreadStarter(),
                m.getCreatedAt(),
                m.getUpdatedAt()
        );
    }

    /**
     * Row of an unread listing. Reads sender and parent, plus the parent's sender
     * when {@code withParentSender} is set; the query must have fetched exactly those.
     */
    public static InboxMessageDto toInboxDto(Message m, boolean withParentSender) {
        return new InboxMessageDto(
                m.getId(),
                toSummary(m.getSender()),
                m.getContent(),
                m.getSentAt(),
                m.isRead(),
                m.isEdited(),
                m.getEditCount(),
                toParentPreview(m.getParentMessageId() != null ? m.getParentMessage() : null, withParentSender)
        );
    }

    public static ParentPreviewDto toParentPreview(Message parent, boolean withSender) {
        if (parent == null) return null;
        return new ParentPreviewDto(
                parent.getId(),
                TextPreview.of(parent.getContent(), PARENT_PREVIEW_CHARS),
                withSender ? parent.getSender().getUsername() : null,
                parent.getSentAt()
        );
    }

    public static UserSummaryDto toSummary(User u) {
        if (u == null) return null;
        return new UserSummaryDto(u.getId(), u.getUsername(), u.getDisplayName());
    }
}
