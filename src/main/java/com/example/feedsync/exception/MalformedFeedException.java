package com.example.feedsync.exception;

public class MalformedFeedException extends RuntimeException {

    public MalformedFeedException(String message, Throwable cause) {
        super(message, cause);
    }
}
