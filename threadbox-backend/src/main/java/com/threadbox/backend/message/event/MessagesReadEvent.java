package com.threadbox.backend.message.event;

import java.util.Collection;
import java.util.UUID;

/** Messages of one receiver that just went from unread to read. */
public record MessagesReadEvent(Long receiverId, Collection<UUID> messageIds) {
}
