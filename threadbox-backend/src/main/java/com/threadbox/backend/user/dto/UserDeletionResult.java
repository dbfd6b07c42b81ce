package com.threadbox.backend.user.dto;

public record UserDeletionResult(
        Long userId,
        String username,
        int messagesDeleted,
        int editHistoriesDeleted,
        int notificationsDeleted
) {
}
