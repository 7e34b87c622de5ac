package com.example.feedsync.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.Objects;

/**
 * Durable hub subscription state for one channel. Rows are never deleted, only
 * transitioned; all mutation goes through the subscription registry.
 */
@Getter
@Setter
@Entity
@Table(name = "channel_subscriptions")
public class ChannelSubscription {

    @Id
    @Column(name = "channel_id", length = 64)
    private String channelId;

    @Column(name = "channel_name")
    private String channelName;

    @Column(name = "topic_url", nullable = false, unique = true, length = 1024)
    private String topicUrl;

    @Column(name = "hub_url", nullable = false, length = 1024)
    private String hubUrl;

    @Column(name = "secret")
    private String secret;

    @Column(name = "lease_expires_at")
    private Instant leaseExpiresAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SubscriptionState state = SubscriptionState.UNSUBSCRIBED;

    @Column(name = "state_reason", length = 1024)
    private String stateReason;

    // Renewal retry bookkeeping for the current cycle
    @Column(name = "renewal_attempts", nullable = false)
    private int renewalAttempts = 0;

    @Column(name = "next_attempt_at")
    private Instant nextAttemptAt;

    @Column(name = "last_renewed_at")
    private Instant lastRenewedAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public ChannelSubscription() {
    }

    public ChannelSubscription(String channelId, String channelName, String topicUrl, String hubUrl, String secret) {
        this.channelId = channelId;
        this.channelName = channelName;
        this.topicUrl = topicUrl;
        this.hubUrl = hubUrl;
        this.secret = secret;
    }

    public boolean hasSecret() {
        return secret != null && !secret.isBlank();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ChannelSubscription that = (ChannelSubscription) o;
        return Objects.equals(channelId, that.channelId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(channelId);
    }

    // secret deliberately left out
    @Override
    public String toString() {
        return "ChannelSubscription{" +
                "channelId='" + channelId + '\'' +
                ", topicUrl='" + topicUrl + '\'' +
                ", state=" + state +
                ", leaseExpiresAt=" + leaseExpiresAt +
                ", renewalAttempts=" + renewalAttempts +
                '}';
    }
}
