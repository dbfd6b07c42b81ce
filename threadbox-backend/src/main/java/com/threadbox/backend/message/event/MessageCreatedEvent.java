package com.threadbox.backend.message.event;

import com.threadbox.backend.message.Message;

public record MessageCreatedEvent(Message message) {
}
