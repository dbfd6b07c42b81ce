package com.threadbox.backend.message.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record EditMessageRequest(
        @NotBlank(message = "content must not be blank") String content,
        @Size(max = 255, message = "reason must be at most 255 characters") String reason
) {
}
