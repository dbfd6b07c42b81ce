package com.threadbox.backend.shared.error;

import org.springframework.http.HttpStatus;

import java.util.UUID;

/** A reply names a parent message that does not exist. */
public class InvalidParentException extends MessagingException {

    private final UUID parentId;

    public InvalidParentException(UUID parentId) {
        super("Parent message does not exist: " + parentId);
        this.parentId = parentId;
    }

    public UUID getParentId() {
        return parentId;
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.BAD_REQUEST;
    }
}
