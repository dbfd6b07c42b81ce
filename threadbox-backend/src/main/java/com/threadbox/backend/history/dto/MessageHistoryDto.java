package com.threadbox.backend.history.dto;

import com.threadbox.backend.user.dto.UserSummaryDto;

import java.time.Instant;

public record MessageHistoryDto(
        Long id,
        String oldContent,
        String newContent,
        String editReason,
        UserSummaryDto editedBy,
        Instant editedAt,
        String editSummary,
        boolean contentChanged
) {
}
