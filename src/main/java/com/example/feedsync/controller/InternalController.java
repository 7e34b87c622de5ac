package com.example.feedsync.controller;

import com.example.feedsync.backfill.BackfillReconciler;
import com.example.feedsync.backfill.BackfillReport;
import com.example.feedsync.config.ChannelProperties.ChannelDefinition;
import com.example.feedsync.ingestion.EnrichmentOutcome;
import com.example.feedsync.ingestion.IngestionQueue;
import com.example.feedsync.model.ChannelSubscription;
import com.example.feedsync.model.DeadLetter;
import com.example.feedsync.model.SubscriptionState;
import com.example.feedsync.registry.SubscriptionRegistry;
import com.example.feedsync.scheduler.LeaseRenewalScheduler;
import com.example.feedsync.service.DeadLetterReprocessor;
import com.example.feedsync.service.DeadLetterService;
import com.example.feedsync.store.CanonicalRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * Operator endpoints for subscriptions, backfill and dead letters.
 */
@Slf4j
@RestController
@RequestMapping("/api/internal")
@RequiredArgsConstructor
public class InternalController {

    private final SubscriptionRegistry registry;
    private final LeaseRenewalScheduler renewalScheduler;
    private final BackfillReconciler backfillReconciler;
    private final DeadLetterService deadLetterService;
    private final DeadLetterReprocessor deadLetterReprocessor;
    private final IngestionQueue ingestionQueue;
    private final CanonicalRecordStore store;

    @GetMapping("/subscriptions")
    public List<SubscriptionView> subscriptions() {
        return registry.list().stream().map(SubscriptionView::of).toList();
    }

    @PostMapping("/subscriptions")
    public ResponseEntity<SubscriptionView> register(@RequestBody ChannelDefinition channel) {
        if (channel.id() == null || channel.id().isBlank()) {
            throw new IllegalArgumentException("Channel id is required");
        }
        log.info("🔧 Manual registration requested for channel: {}", channel.id());
        return ResponseEntity.ok(SubscriptionView.of(registry.register(channel)));
    }

    @DeleteMapping("/subscriptions/{channelId}")
    public ResponseEntity<SubscriptionView> unsubscribe(@PathVariable String channelId) {
        log.info("🔧 Manual unsubscribe requested for channel: {}", channelId);
        return ResponseEntity.ok(SubscriptionView.of(renewalScheduler.unsubscribe(channelId)));
    }

    @PostMapping("/subscriptions/{channelId}/renew")
    public ResponseEntity<String> renewChannel(@PathVariable String channelId) {
        log.info("🔧 Manual renewal requested for channel: {}", channelId);
        if (!renewalScheduler.renewNow(channelId)) {
            return ResponseEntity.status(409).body("❌ Renewal already in progress for channel: " + channelId);
        }
        SubscriptionState state = registry.get(channelId).map(ChannelSubscription::getState).orElse(null);
        return ResponseEntity.ok("✅ Renewal finished for channel " + channelId + ", state " + state);
    }

    @PostMapping("/renew")
    public ResponseEntity<String> renewDue() {
        log.info("🔄 Manual renewal cycle requested");
        int issued = renewalScheduler.runRenewalCycle();
        return ResponseEntity.ok("✅ Renewal cycle issued " + issued + " hub request(s)");
    }

    @PostMapping("/backfill/{channelId}")
    public ResponseEntity<BackfillReport> backfill(@PathVariable String channelId,
                                                   @RequestParam(required = false) Integer limit) {
        log.info("📥 Manual backfill requested for channel: {} (limit {})", channelId, limit);
        if (!registry.isTracked(channelId)) {
            throw new IllegalArgumentException("Channel is not tracked: " + channelId);
        }
        try {
            return ResponseEntity.ok(backfillReconciler.reconcileAsync(channelId, limit).join());
        } catch (CompletionException ex) {
            if (ex.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw ex;
        }
    }

    @GetMapping("/dead-letters")
    public List<DeadLetterView> deadLetters() {
        return deadLetterService.list().stream().map(DeadLetterView::of).toList();
    }

    @PostMapping("/dead-letters/reprocess")
    public Map<EnrichmentOutcome, Integer> reprocessDeadLetters() {
        log.info("🔄 Manual dead-letter reprocessing requested");
        return deadLetterReprocessor.reprocessAll();
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "UP",
                "subscriptions", registry.list().size(),
                "records", store.count(),
                "queueDepth", ingestionQueue.depth(),
                "queueRemaining", ingestionQueue.remainingCapacity(),
                "deadLetters", deadLetterService.count()));
    }

    public record SubscriptionView(String channelId,
                                   String channelName,
                                   String topicUrl,
                                   SubscriptionState state,
                                   String stateReason,
                                   Instant leaseExpiresAt,
                                   int renewalAttempts,
                                   Instant nextAttemptAt,
                                   Instant lastRenewedAt) {

        static SubscriptionView of(ChannelSubscription s) {
            return new SubscriptionView(s.getChannelId(), s.getChannelName(), s.getTopicUrl(), s.getState(),
                    s.getStateReason(), s.getLeaseExpiresAt(), s.getRenewalAttempts(), s.getNextAttemptAt(),
                    s.getLastRenewedAt());
        }
    }

    public record DeadLetterView(String itemId, String channelId, String origin, String reason,
                                 int attempts, Instant createdAt, Instant lastFailedAt) {

        static DeadLetterView of(DeadLetter d) {
            return new DeadLetterView(d.getItemId(), d.getChannelId(), d.getOrigin().name(), d.getReason(),
                    d.getAttempts(), d.getCreatedAt(), d.getLastFailedAt());
        }
    }
}
