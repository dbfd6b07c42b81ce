package com.threadbox.backend.inbox.dto;

import com.threadbox.backend.message.dto.ParentPreviewDto;
import com.threadbox.backend.user.dto.UserSummaryDto;

import java.time.Instant;
import java.util.UUID;

public record InboxMessageDto(
        UUID id,
        UserSummaryDto sender,
        String content,
        Instant sentAt,
        boolean read,
        boolean edited,
        int editCount,
        ParentPreviewDto parent
) {
}
