package com.threadbox.backend.message.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.UUID;

public record CreateMessageRequest(
        @NotNull(message = "receiverId is required") Long receiverId,
        @NotBlank(message = "content must not be blank") String content,
        UUID parentMessageId
) {
}
