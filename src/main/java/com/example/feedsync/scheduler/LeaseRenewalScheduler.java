package com.example.feedsync.scheduler;

import com.example.feedsync.client.HubClient;
import com.example.feedsync.model.ChannelSubscription;
import com.example.feedsync.model.SubscriptionState;
import com.example.feedsync.registry.RenewalBackoff;
import com.example.feedsync.registry.SubscriptionRegistry;
import com.example.feedsync.service.IngestionMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * Keeps hub leases alive.
 *
 * <p>Each tick selects the channels that are due: pending channels, and
 * active/expiring channels whose lease ends within the renewal margin, in
 * both cases only once their next-attempt time has passed. Failed channels
 * come back after their cool-down. A channel already being renewed is never
 * selected twice. Subscribe requests run on the bounded renewal executor; a
 * failed attempt is recorded on the subscription and retried on a later tick.
 */
@Slf4j
@Service
public class LeaseRenewalScheduler {

    private final HubClient hubClient;
    private final SubscriptionRegistry registry;
    private final ThreadPoolTaskExecutor renewalExecutor;
    private final Clock clock;
    private final IngestionMetrics metrics;

    private final boolean enabled;
    private final Duration margin;
    private final long leaseSeconds;
    private final RenewalBackoff backoff;

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private volatile boolean stopping = false;

    public LeaseRenewalScheduler(HubClient hubClient,
                                 SubscriptionRegistry registry,
                                 @Qualifier("renewalExecutor") ThreadPoolTaskExecutor renewalExecutor,
                                 Clock clock,
                                 IngestionMetrics metrics,
                                 @Value("${app.renewal.enabled:true}") boolean enabled,
                                 @Value("${app.renewal.margin:1h}") Duration margin,
                                 @Value("${app.hub.lease-seconds:864000}") long leaseSeconds,
                                 @Value("${app.renewal.max-attempts:3}") int maxAttempts,
                                 @Value("${app.renewal.initial-backoff:30s}") Duration initialBackoff,
                                 @Value("${app.renewal.max-backoff:30m}") Duration maxBackoff) {
        this.hubClient = hubClient;
        this.registry = registry;
        this.renewalExecutor = renewalExecutor;
        this.clock = clock;
        this.metrics = metrics;
        this.enabled = enabled;
        this.margin = margin;
        this.leaseSeconds = leaseSeconds;
        this.backoff = new RenewalBackoff(maxAttempts, initialBackoff, maxBackoff);
    }

    @Scheduled(fixedDelayString = "${app.renewal.tick-ms:60000}", initialDelayString = "${app.renewal.tick-ms:60000}")
    public void scheduledTick() {
        if (!enabled) {
            return;
        }
        runRenewalCycle();
    }

    /**
     * Runs one tick and waits for the renewals it started.
     *
     * @return number of channels a subscribe request was issued for
     */
    public int runRenewalCycle() {
        if (stopping) {
            log.debug("Renewal cycle skipped, shutting down");
            return 0;
        }
        Instant now = clock.instant();
        List<ChannelSubscription> due = registry.list().stream()
                .filter(subscription -> isDue(subscription, now))
                .toList();
        if (due.isEmpty()) {
            log.debug("No subscriptions due for renewal");
            return 0;
        }
        log.info("🔄 Renewal cycle: {} channel(s) due", due.size());

        List<Future<?>> futures = new ArrayList<>();
        for (ChannelSubscription subscription : due) {
            String channelId = subscription.getChannelId();
            if (!inFlight.add(channelId)) {
                continue;
            }
            try {
                futures.add(renewalExecutor.submit(() -> renew(channelId)));
            } catch (RejectedExecutionException ex) {
                inFlight.remove(channelId);
                log.warn("Renewal executor rejected channel {}: {}", channelId, ex.getMessage());
            }
        }

        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (ExecutionException ex) {
                log.error("Renewal task failed unexpectedly: {}", ex.getCause().getMessage(), ex.getCause());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        return futures.size();
    }

    /**
     * Issues a subscribe request for one channel now, outside the tick, unless
     * a renewal for it is already running.
     *
     * @return false when a renewal was already in flight
     */
    public boolean renewNow(String channelId) {
        registry.get(channelId).orElseThrow(() -> new IllegalArgumentException("Unknown channel: " + channelId));
        if (!inFlight.add(channelId)) {
            return false;
        }
        renew(channelId);
        return true;
    }

    /**
     * Moves the channel to {@code UNSUBSCRIBED} and asks the hub to stop
     * delivery. The state changes whatever the hub answers.
     */
    public ChannelSubscription unsubscribe(String channelId) {
        ChannelSubscription subscription = registry.unsubscribe(channelId);
        try {
            hubClient.unsubscribe(subscription);
            log.info("Hub unsubscribe requested for channel {}", channelId);
        } catch (RuntimeException ex) {
            log.warn("Hub unsubscribe for channel {} failed, channel stays UNSUBSCRIBED locally: {}",
                    channelId, ex.getMessage());
        }
        return subscription;
    }

    public boolean isInFlight(String channelId) {
        return inFlight.contains(channelId);
    }

    @EventListener(ContextClosedEvent.class)
    public void onShutdown() {
        stopping = true;
        log.info("Lease renewal scheduler stopping; in-flight renewals: {}", inFlight.size());
    }

    boolean isDue(ChannelSubscription subscription, Instant now) {
        if (inFlight.contains(subscription.getChannelId())) {
            return false;
        }
        Instant nextAttemptAt = subscription.getNextAttemptAt();
        if (nextAttemptAt != null && now.isBefore(nextAttemptAt)) {
            return false;
        }
        return switch (subscription.getState()) {
            case PENDING, FAILED -> true;
            case ACTIVE, EXPIRING -> subscription.getLeaseExpiresAt() == null
                    || !now.isBefore(subscription.getLeaseExpiresAt().minus(margin));
            case UNSUBSCRIBED -> false;
        };
    }

    private void renew(String channelId) {
        try {
            ChannelSubscription subscription = registry.get(channelId).orElse(null);
            if (subscription == null || subscription.getState() == SubscriptionState.UNSUBSCRIBED) {
                return;
            }
            if (subscription.getState() == SubscriptionState.FAILED) {
                subscription = registry.restartCycle(channelId);
            } else if (subscription.getState() == SubscriptionState.ACTIVE) {
                subscription = registry.markExpiring(channelId);
            }

            Instant requestedAt = clock.instant();
            try {
                hubClient.subscribe(subscription, leaseSeconds);
            } catch (RuntimeException ex) {
                registry.recordRenewalFailure(channelId, ex.getMessage(), backoff);
                return;
            }
            registry.markAccepted(channelId, leaseSeconds, requestedAt);
            metrics.recordRenewed();
        } catch (RuntimeException ex) {
            // one channel never stops the others
            log.error("❌ Renewal of channel {} aborted: {}", channelId, ex.getMessage(), ex);
        } finally {
            inFlight.remove(channelId);
        }
    }
}
