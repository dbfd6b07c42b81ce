package com.threadbox.backend.message.event;

import java.util.Collection;
import java.util.UUID;

/**
 * Fired before the message rows are removed, with every id of the
 * affected subtrees, so dependents can be cleared first.
 */
public record MessagesDeletingEvent(Collection<UUID> messageIds) {
}
