package com.example.feedsync.model;

/**
 * Lifecycle of a channel's hub subscription.
 * <pre>
 * unsubscribed -> pending -> active -> expiring -> active | failed
 * any -> unsubscribed (explicit), unsubscribed | failed -> pending (re-register)
 * </pre>
 */
public enum SubscriptionState {
    UNSUBSCRIBED,
    PENDING,
    ACTIVE,
    EXPIRING,
    FAILED
}
