package com.threadbox.backend.shared.error;

import org.springframework.http.HttpStatus;

/** A referenced message, parent or user does not exist. */
public class NotFoundException extends MessagingException {

    public NotFoundException(String message) {
        super(message);
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.NOT_FOUND;
    }
}
