package com.threadbox.backend.shared.error;

import org.springframework.http.HttpStatus;

/** The acting user may not perform this action on the message. */
public class PermissionDeniedException extends MessagingException {

    public PermissionDeniedException(String message) {
        super(message);
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.FORBIDDEN;
    }
}
