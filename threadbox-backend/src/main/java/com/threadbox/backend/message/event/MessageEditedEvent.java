package com.threadbox.backend.message.event;

import com.threadbox.backend.message.Message;
import com.threadbox.backend.user.User;

/**
 * Fired only when an edit actually changed the content.
 * {@code message} already carries {@code newContent}.
 */
public record MessageEditedEvent(
        Message message,
        String oldContent,
        String newContent,
        User editor,
        String reason
) {
}
