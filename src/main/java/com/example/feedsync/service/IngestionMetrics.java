package com.example.feedsync.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Counters for every place the pipeline drops, rejects or gives up on work.
 * Nothing here changes behaviour; it only makes the isolated failures visible.
 */
@Slf4j
@Service
public class IngestionMetrics {

    private final MeterRegistry meterRegistry;

    private final Counter pushReceived;
    private final Counter pushRejectedSignature;
    private final Counter pushRejectedBackpressure;
    private final Counter pushRejectedMalformed;
    private final Counter entriesDropped;
    private final Counter entriesDeleted;
    private final Counter notFound;
    private final Counter deadLettered;
    private final Counter retries;
    private final Counter inserted;
    private final Counter updated;
    private final Counter renewed;

    public IngestionMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.pushReceived = meterRegistry.counter("feedsync.push.received");
        this.pushRejectedSignature = meterRegistry.counter("feedsync.push.rejected", "reason", "signature");
        this.pushRejectedBackpressure = meterRegistry.counter("feedsync.push.rejected", "reason", "backpressure");
        this.pushRejectedMalformed = meterRegistry.counter("feedsync.push.rejected", "reason", "malformed");
        this.entriesDropped = meterRegistry.counter("feedsync.feed.entries.dropped");
        this.entriesDeleted = meterRegistry.counter("feedsync.feed.entries.deleted");
        this.notFound = meterRegistry.counter("feedsync.enrichment.not_found");
        this.deadLettered = meterRegistry.counter("feedsync.enrichment.dead_lettered");
        this.retries = meterRegistry.counter("feedsync.enrichment.retries");
        this.inserted = meterRegistry.counter("feedsync.records.inserted");
        this.updated = meterRegistry.counter("feedsync.records.updated");
        this.renewed = meterRegistry.counter("feedsync.subscriptions.renewed");
    }

    public void recordPushReceived() {
        pushReceived.increment();
    }

    public void recordSignatureRejected() {
        pushRejectedSignature.increment();
        log.debug("Recorded signature rejection - Total: {}", pushRejectedSignature.count());
    }

    public void recordBackpressureRejected() {
        pushRejectedBackpressure.increment();
        log.debug("Recorded backpressure rejection - Total: {}", pushRejectedBackpressure.count());
    }

    public void recordMalformedPush() {
        pushRejectedMalformed.increment();
    }

    public void recordEntriesDropped(int count) {
        if (count > 0) {
            entriesDropped.increment(count);
        }
    }

    public void recordEntriesDeleted(int count) {
        if (count > 0) {
            entriesDeleted.increment(count);
        }
    }

    public void recordNotFound() {
        notFound.increment();
    }

    public void recordDeadLettered() {
        deadLettered.increment();
    }

    public void recordRetry() {
        retries.increment();
    }

    public void recordUpsert(boolean wasInsert) {
        (wasInsert ? inserted : updated).increment();
    }

    public void recordRenewed() {
        renewed.increment();
    }

    public void recordSubscriptionFailed(String channelId) {
        meterRegistry.counter("feedsync.subscriptions.failed", "channel", channelId).increment();
    }

    public long getPushReceivedCount() {
        return (long) pushReceived.count();
    }

    public long getSignatureRejectedCount() {
        return (long) pushRejectedSignature.count();
    }

    public long getBackpressureRejectedCount() {
        return (long) pushRejectedBackpressure.count();
    }

    public long getEntriesDroppedCount() {
        return (long) entriesDropped.count();
    }

    public long getNotFoundCount() {
        return (long) notFound.count();
    }

    public long getDeadLetteredCount() {
        return (long) deadLettered.count();
    }

    public long getRetriesCount() {
        return (long) retries.count();
    }

    public long getInsertedCount() {
        return (long) inserted.count();
    }

    public long getUpdatedCount() {
        return (long) updated.count();
    }

    public long getSubscriptionFailedCount(String channelId) {
        return (long) meterRegistry.counter("feedsync.subscriptions.failed", "channel", channelId).count();
    }
}
