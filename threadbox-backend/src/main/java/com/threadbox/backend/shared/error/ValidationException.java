package com.threadbox.backend.shared.error;

import org.springframework.http.HttpStatus;

public class ValidationException extends MessagingException {

    public ValidationException(String message) {
        super(message);
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.BAD_REQUEST;
    }
}
