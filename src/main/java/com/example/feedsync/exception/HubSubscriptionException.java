package com.example.feedsync.exception;

/**
 * A single subscribe or unsubscribe request to the hub did not succeed.
 */
public class HubSubscriptionException extends RuntimeException {

    public HubSubscriptionException(String message) {
        super(message);
    }

    public HubSubscriptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
