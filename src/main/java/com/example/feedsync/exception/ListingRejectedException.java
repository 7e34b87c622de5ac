package com.example.feedsync.exception;

/**
 * The listing source refused a channel listing with a non-transient error.
 * Not retried.
 */
public class ListingRejectedException extends RuntimeException {

    public ListingRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
