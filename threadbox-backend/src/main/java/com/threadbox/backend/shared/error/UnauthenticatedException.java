package com.threadbox.backend.shared.error;

import org.springframework.http.HttpStatus;

/** No acting user was supplied with the request. */
public class UnauthenticatedException extends MessagingException {

    public UnauthenticatedException(String message) {
        super(message);
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.UNAUTHORIZED;
    }
}
