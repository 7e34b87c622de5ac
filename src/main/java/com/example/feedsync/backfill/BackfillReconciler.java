package com.example.feedsync.backfill;

import com.example.feedsync.client.MetadataSource;
import com.example.feedsync.ingestion.EnrichmentOutcome;
import com.example.feedsync.ingestion.MetadataEnricher;
import com.example.feedsync.model.ChannelSubscription;
import com.example.feedsync.model.ItemOrigin;
import com.example.feedsync.model.ItemStub;
import com.example.feedsync.model.SubscriptionState;
import com.example.feedsync.registry.SubscriptionRegistry;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Walks the most recent items of a channel and pushes each one through the
 * same {@link MetadataEnricher} the push path uses. There is no storage logic
 * here, so the store stays the only place items are deduplicated.
 */
@Slf4j
@Service
public class BackfillReconciler {

    private final MetadataSource metadataSource;
    private final MetadataEnricher enricher;
    private final SubscriptionRegistry registry;
    private final ThreadPoolTaskExecutor backfillExecutor;
    private final RateLimiter listingRateLimiter;
    private final Retry listingRetry;
    private final Clock clock;

    private final boolean enabled;
    private final int defaultLimit;

    private volatile boolean stopping = false;

    public BackfillReconciler(MetadataSource metadataSource,
                              MetadataEnricher enricher,
                              SubscriptionRegistry registry,
                              @Qualifier("backfillExecutor") ThreadPoolTaskExecutor backfillExecutor,
                              @Qualifier("listingRateLimiter") RateLimiter listingRateLimiter,
                              @Qualifier("listingRetry") Retry listingRetry,
                              Clock clock,
                              @Value("${app.backfill.enabled:false}") boolean enabled,
                              @Value("${app.backfill.limit:1000}") int defaultLimit) {
        this.metadataSource = metadataSource;
        this.enricher = enricher;
        this.registry = registry;
        this.backfillExecutor = backfillExecutor;
        this.listingRateLimiter = listingRateLimiter;
        this.listingRetry = listingRetry;
        this.clock = clock;
        this.enabled = enabled;
        this.defaultLimit = defaultLimit;
    }

    @Scheduled(cron = "${app.backfill.cron:0 30 3 * * *}")
    public void runScheduledBackfill() {
        if (!enabled) {
            return;
        }
        queueAllChannels();
    }

    /**
     * Queues one backfill per tracked channel on the backfill executor and
     * returns without waiting, so the scheduler thread stays free for renewals.
     *
     * @return the queued runs
     */
    public List<CompletableFuture<BackfillReport>> queueAllChannels() {
        if (stopping) {
            return List.of();
        }
        log.info("🌙 Starting scheduled backfill...");
        List<CompletableFuture<BackfillReport>> runs = new ArrayList<>();
        for (ChannelSubscription subscription : registry.list()) {
            if (subscription.getState() == SubscriptionState.UNSUBSCRIBED) {
                continue;
            }
            String channelId = subscription.getChannelId();
            try {
                runs.add(reconcileAsync(channelId, defaultLimit));
            } catch (TaskRejectedException ex) {
                log.warn("Backfill for channel {} not queued: {}", channelId, ex.getMessage());
            }
        }
        CompletableFuture.allOf(runs.toArray(new CompletableFuture[0])).whenComplete((ignored, error) -> {
            if (error != null) {
                log.error("❌ Scheduled backfill ended with an error: {}", error.getMessage());
                return;
            }
            log.info("✅ Scheduled backfill complete: {} channel(s), {} item(s) stored", runs.size(),
                    runs.stream().map(CompletableFuture::join).mapToInt(BackfillReport::stored).sum());
        });
        return runs;
    }

    public CompletableFuture<BackfillReport> reconcileAsync(String channelId, Integer limit) {
        int effectiveLimit = limit != null ? limit : defaultLimit;
        return backfillExecutor.submitCompletable(() -> reconcile(channelId, effectiveLimit));
    }

    /**
     * Feeds up to {@code limit} of the channel's most recent items through
     * enrichment. A failing item is counted as dead-lettered and the run moves
     * on; a listing failure ends the run with an error in the report.
     */
    public BackfillReport reconcile(String channelId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        if (!registry.isTracked(channelId)) {
            throw new IllegalArgumentException("Channel is not tracked: " + channelId);
        }
        Instant startedAt = clock.instant();
        log.info("📥 Backfill for channel {} (limit {})", channelId, limit);

        List<String> itemIds;
        try {
            itemIds = listRecent(channelId, limit);
        } catch (RuntimeException ex) {
            log.error("❌ Backfill listing for channel {} failed: {}", channelId, ex.getMessage());
            return new BackfillReport(channelId, 0, 0, 0, 0, 0,
                    ex.getClass().getSimpleName() + ": " + ex.getMessage(), false, startedAt, clock.instant());
        }
        if (itemIds.size() > limit) {
            itemIds = itemIds.subList(0, limit);
        }

        Map<EnrichmentOutcome, Integer> outcomes = new EnumMap<>(EnrichmentOutcome.class);
        boolean interrupted = false;
        int processed = 0;
        for (String itemId : itemIds) {
            if (stopping || Thread.currentThread().isInterrupted()) {
                interrupted = true;
                log.warn("Backfill for channel {} stopped after {} of {} items", channelId, processed, itemIds.size());
                break;
            }
            EnrichmentOutcome outcome;
            try {
                outcome = enricher.enrich(new ItemStub(itemId, channelId, null, ItemOrigin.BACKFILL));
            } catch (RuntimeException ex) {
                log.error("❌ Backfill item {} of channel {} failed: {}", itemId, channelId, ex.getMessage(), ex);
                outcome = EnrichmentOutcome.DEAD_LETTERED;
            }
            outcomes.merge(outcome, 1, Integer::sum);
            processed++;
            if (processed % 100 == 0) {
                log.info("🔄 Backfill progress for channel {}: {}/{}", channelId, processed, itemIds.size());
            }
        }

        BackfillReport report = new BackfillReport(channelId, itemIds.size(),
                outcomes.getOrDefault(EnrichmentOutcome.INSERTED, 0),
                outcomes.getOrDefault(EnrichmentOutcome.UPDATED, 0),
                outcomes.getOrDefault(EnrichmentOutcome.NOT_FOUND, 0),
                outcomes.getOrDefault(EnrichmentOutcome.DEAD_LETTERED, 0),
                null, interrupted, startedAt, clock.instant());
        log.info("✅ Backfill for channel {} done: {} listed, {} inserted, {} updated, {} not found, {} dead-lettered",
                channelId, report.listed(), report.inserted(), report.updated(), report.notFound(), report.deadLettered());
        return report;
    }

    @EventListener(ContextClosedEvent.class)
    public void onShutdown() {
        stopping = true;
    }

    private List<String> listRecent(String channelId, int limit) {
        Supplier<List<String>> call = () -> metadataSource.listRecentItemIds(channelId, limit);
        Supplier<List<String>> limited = RateLimiter.decorateSupplier(listingRateLimiter, call);
        return Retry.decorateSupplier(listingRetry, limited).get();
    }
}
