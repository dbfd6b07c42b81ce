package com.threadbox.backend.user.dto;

public record UserSummaryDto(
        Long id,
        String username,
        String displayName
) {
}
