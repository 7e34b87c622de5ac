package com.example.feedsync.model;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * Marker for an item whose enrichment kept failing. Kept for inspection and
 * optional reprocessing; removed once the item is stored successfully.
 */
@Entity
@Table(name = "dead_letters", uniqueConstraints = @UniqueConstraint(columnNames = "item_id"))
public class DeadLetter {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "item_id", nullable = false, length = 64)
    private String itemId;

    @Column(name = "channel_id", length = 64)
    private String channelId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ItemOrigin origin;

    @Column(length = 2048)
    private String reason;

    @Column(nullable = false)
    private int attempts;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "last_failed_at", nullable = false)
    private Instant lastFailedAt;

    protected DeadLetter() {
    }

    public DeadLetter(ItemStub stub, String reason, int attempts, Instant failedAt) {
        this.itemId = stub.itemId();
        this.channelId = stub.channelId();
        this.origin = stub.origin();
        this.reason = reason;
        this.attempts = attempts;
        this.createdAt = failedAt;
        this.lastFailedAt = failedAt;
    }

    public void recordFailure(String reason, int attempts, Instant failedAt) {
        this.reason = reason;
        this.attempts += attempts;
        this.lastFailedAt = failedAt;
    }

    public ItemStub toStub() {
        return new ItemStub(itemId, channelId, null, origin);
    }

    public Long getId() {
        return id;
    }

    public String getItemId() {
        return itemId;
    }

    public String getChannelId() {
        return channelId;
    }

    public ItemOrigin getOrigin() {
        return origin;
    }

    public String getReason() {
        return reason;
    }

    public int getAttempts() {
        return attempts;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastFailedAt() {
        return lastFailedAt;
    }
}
