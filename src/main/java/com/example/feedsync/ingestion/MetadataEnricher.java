package com.example.feedsync.ingestion;

import com.example.feedsync.client.MetadataSource;
import com.example.feedsync.exception.ItemNotFoundException;
import com.example.feedsync.model.ItemMetadata;
import com.example.feedsync.model.ItemStub;
import com.example.feedsync.service.DeadLetterService;
import com.example.feedsync.service.IngestionMetrics;
import com.example.feedsync.store.CanonicalRecordStore;
import com.example.feedsync.store.UpsertResult;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.function.Supplier;

/**
 * Resolves stubs from either producer into full records and hands them to the
 * store. This is the only path into {@link CanonicalRecordStore}.
 *
 * <p>Each metadata call holds a permit of the shared bulkhead and a token of
 * the shared rate limiter. Transient failures are retried with exponential
 * backoff and end up as a dead letter; a missing item is counted and dropped.
 * No outcome escapes as an exception.
 */
@Slf4j
@Service
public class MetadataEnricher {

    private final MetadataSource metadataSource;
    private final CanonicalRecordStore store;
    private final DeadLetterService deadLetters;
    private final IngestionMetrics metrics;
    private final RateLimiter rateLimiter;
    private final Bulkhead bulkhead;
    private final Retry retry;

    public MetadataEnricher(MetadataSource metadataSource,
                            CanonicalRecordStore store,
                            DeadLetterService deadLetters,
                            IngestionMetrics metrics,
                            @Qualifier("metadataRateLimiter") RateLimiter rateLimiter,
                            @Qualifier("metadataBulkhead") Bulkhead bulkhead,
                            @Qualifier("metadataRetry") Retry retry) {
        this.metadataSource = metadataSource;
        this.store = store;
        this.deadLetters = deadLetters;
        this.metrics = metrics;
        this.rateLimiter = rateLimiter;
        this.bulkhead = bulkhead;
        this.retry = retry;
        retry.getEventPublisher().onRetry(event -> {
            metrics.recordRetry();
            log.debug("Retrying metadata call (attempt {}): {}", event.getNumberOfRetryAttempts(),
                    event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "");
        });
    }

    public EnrichmentOutcome enrich(ItemStub stub) {
        ItemMetadata metadata;
        try {
            metadata = fetch(stub.itemId());
        } catch (ItemNotFoundException ex) {
            metrics.recordNotFound();
            log.info("Item {} not available at metadata source; dropping ({} origin)", stub.itemId(), stub.origin());
            return EnrichmentOutcome.NOT_FOUND;
        } catch (RuntimeException ex) {
            return deadLetter(stub, describe(ex), retry.getRetryConfig().getMaxAttempts());
        }

        UpsertResult result;
        try {
            result = store.upsert(withStubDefaults(metadata, stub), stub.origin());
        } catch (RuntimeException ex) {
            log.error("Failed to store item {}: {}", stub.itemId(), ex.getMessage(), ex);
            return deadLetter(stub, "store failure: " + describe(ex), 1);
        }
        metrics.recordUpsert(result.inserted());
        log.info("{} item: {} - {} via {}", result.inserted() ? "Inserted" : "Updated",
                stub.itemId(), metadata.title(), stub.origin());
        try {
            deadLetters.resolve(stub.itemId());
        } catch (RuntimeException ex) {
            log.warn("Stored item {} but could not clear its dead letter: {}", stub.itemId(), ex.getMessage());
        }
        return result.inserted() ? EnrichmentOutcome.INSERTED : EnrichmentOutcome.UPDATED;
    }

    private EnrichmentOutcome deadLetter(ItemStub stub, String reason, int attempts) {
        try {
            deadLetters.record(stub, reason, attempts);
        } catch (RuntimeException ex) {
            // the marker is lost, the item still counts as given up
            log.error("❌ Could not persist dead letter for item {} ({}): {}", stub.itemId(), reason, ex.getMessage(), ex);
        }
        return EnrichmentOutcome.DEAD_LETTERED;
    }

    private ItemMetadata fetch(String itemId) {
        Supplier<ItemMetadata> call = () -> metadataSource.fetchItem(itemId);
        Supplier<ItemMetadata> limited = RateLimiter.decorateSupplier(rateLimiter, call);
        Supplier<ItemMetadata> bounded = Bulkhead.decorateSupplier(bulkhead, limited);
        return Retry.decorateSupplier(retry, bounded).get();
    }

    /**
     * The source may omit fields the producer already knew.
     */
    private ItemMetadata withStubDefaults(ItemMetadata metadata, ItemStub stub) {
        return new ItemMetadata(
                stub.itemId(),
                metadata.title(),
                metadata.url(),
                metadata.channelId() != null ? metadata.channelId() : stub.channelId(),
                metadata.channelName(),
                metadata.publishedAt() != null ? metadata.publishedAt() : stub.candidateTimestamp(),
                metadata.viewCount(),
                metadata.likeCount(),
                metadata.commentCount(),
                metadata.durationSeconds(),
                metadata.tags(),
                metadata.description(),
                metadata.thumbnailUrl());
    }

    private static String describe(Throwable ex) {
        return ex.getClass().getSimpleName() + ": " + ex.getMessage();
    }
}
