package com.example.feedsync.exception;

/**
 * Handshake for a topic this service never asked to subscribe to.
 */
public class UnknownTopicException extends AuthenticationException {

    private final String topic;

    public UnknownTopicException(String topic) {
        super("Unknown topic: " + topic);
        this.topic = topic;
    }

    public String getTopic() {
        return topic;
    }
}
