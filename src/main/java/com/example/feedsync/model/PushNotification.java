package com.example.feedsync.model;

import java.time.Instant;

/**
 * One inbound push as received, before it is verified. Lives for the duration
 * of a single request.
 *
 * @param body       raw request body bytes, exactly as signed by the hub
 * @param signature  value of the {@code X-Hub-Signature} header, may be null
 * @param topicHint  topic from the {@code Link rel="self"} header, may be null
 * @param receivedAt receipt timestamp
 */
public record PushNotification(
        byte[] body,
        String signature,
        String topicHint,
        Instant receivedAt
) { }
