package com.threadbox.backend.message.dto;

import java.time.Instant;
import java.util.UUID;

/** Short view of the message being replied to. {@code senderUsername} is only filled by the inbox. */
public record ParentPreviewDto(
        UUID id,
        String content,
        String senderUsername,
        Instant sentAt
) {
}
