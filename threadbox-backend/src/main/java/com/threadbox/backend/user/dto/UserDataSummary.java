package com.threadbox.backend.user.dto;

/** What deleting the account would remove, before any reply subtrees are counted. */
public record UserDataSummary(
        Long userId,
        String username,
        long sentMessages,
        long receivedMessages,
        long notifications,
        long editHistoriesAuthored,
        long historiesOnReceivedMessages
) {
    public long totalMessages() {
        return sentMessages + receivedMessages;
    }
}
