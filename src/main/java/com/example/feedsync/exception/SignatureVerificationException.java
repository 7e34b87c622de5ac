package com.example.feedsync.exception;

public class SignatureVerificationException extends AuthenticationException {

    public SignatureVerificationException(String message) {
        super(message);
    }

    public SignatureVerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
