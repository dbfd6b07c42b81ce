package com.threadbox.backend.shared.error;

import org.springframework.http.HttpStatus;

/**
 * Base of every failure the messaging core reports to its callers.
 * Each subtype carries the HTTP status a web layer should answer with.
 */
public abstract class MessagingException extends RuntimeException {

    protected MessagingException(String message) {
        super(message);
    }

    public abstract HttpStatus status();
}
