package com.threadbox.backend.message.dto;

import com.threadbox.backend.user.dto.UserSummaryDto;

import java.time.Instant;
import java.util.UUID;

public record MessageDto(
        UUID id,
        UserSummaryDto sender,
        UserSummaryDto receiver,
        String content,
        UUID parentMessageId,
        Instant sentAt,
        boolean read,
        boolean edited,
        int editCount,
        boolean reply,
        boolean threadStarter,
        Instant createdAt,
        Instant updatedAt
) {
}
