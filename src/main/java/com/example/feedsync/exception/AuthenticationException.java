package com.example.feedsync.exception;

/**
 * Inbound request could not be authenticated. Never retried internally; the
 * hub's own redelivery policy decides what happens next.
 */
public class AuthenticationException extends RuntimeException {

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
