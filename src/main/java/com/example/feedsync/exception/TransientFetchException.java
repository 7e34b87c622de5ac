package com.example.feedsync.exception;

/**
 * Timeout, rate limiting or transport failure from the metadata or listing source.
 */
public class TransientFetchException extends RuntimeException {

    public TransientFetchException(String message) {
        super(message);
    }

    public TransientFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
