package com.example.feedsync.registry;

import com.example.feedsync.config.ChannelProperties.ChannelDefinition;
import com.example.feedsync.model.ChannelSubscription;
import com.example.feedsync.model.SubscriptionState;
import com.example.feedsync.repository.ChannelSubscriptionRepository;
import com.example.feedsync.service.IngestionMetrics;
import com.example.feedsync.util.StripedLocks;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Owns the persisted subscription state of every tracked channel.
 *
 * <p>Reads go straight to the repository and are safe from any thread. Writes
 * for one channel are serialized through a striped lock that is held around the
 * whole transaction, so a renewal result and a hub handshake for the same
 * channel never interleave. Writes for different channels run in parallel.
 */
@Slf4j
@Service
public class SubscriptionRegistry {

    private final ChannelSubscriptionRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final IngestionMetrics metrics;
    private final StripedLocks locks = new StripedLocks(32);

    private final String hubUrl;
    private final String topicTemplate;
    private final String globalSecret;
    private final Duration failedCooldown;

    public SubscriptionRegistry(ChannelSubscriptionRepository repository,
                                PlatformTransactionManager transactionManager,
                                Clock clock,
                                IngestionMetrics metrics,
                                @Value("${app.hub.url}") String hubUrl,
                                @Value("${app.hub.topic-template}") String topicTemplate,
                                @Value("${app.webhook.secret:}") String globalSecret,
                                @Value("${app.renewal.failed-cooldown:6h}") Duration failedCooldown) {
        this.repository = repository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
        this.metrics = metrics;
        this.hubUrl = hubUrl;
        this.topicTemplate = topicTemplate;
        this.globalSecret = globalSecret;
        this.failedCooldown = failedCooldown;
    }

    /**
     * Creates the channel in state {@code PENDING} if it is absent, or moves an
     * {@code UNSUBSCRIBED}/{@code FAILED} channel back to {@code PENDING}.
     * Channels that are pending, active or expiring are left untouched.
     */
    public ChannelSubscription register(ChannelDefinition channel) {
        return locks.withLock(channel.id(), () -> transactionTemplate.execute(status -> {
            Instant now = clock.instant();
            Optional<ChannelSubscription> existing = repository.findById(channel.id());
            if (existing.isEmpty()) {
                String secret = channel.secret() != null && !channel.secret().isBlank() ? channel.secret() : globalSecret;
                ChannelSubscription created = new ChannelSubscription(
                        channel.id(), channel.name(), topicUrlFor(channel.id()), hubUrl, secret);
                created.setState(SubscriptionState.PENDING);
                created.setCreatedAt(now);
                created.setUpdatedAt(now);
                log.info("Registered channel {} ({}) as PENDING", channel.id(), channel.name());
                return repository.save(created);
            }

            ChannelSubscription subscription = existing.get();
            SubscriptionState state = subscription.getState();
            if (state == SubscriptionState.UNSUBSCRIBED || state == SubscriptionState.FAILED) {
                subscription.setState(SubscriptionState.PENDING);
                subscription.setStateReason(null);
                subscription.setRenewalAttempts(0);
                subscription.setNextAttemptAt(null);
                subscription.setUpdatedAt(now);
                log.info("Re-registered channel {} ({} -> PENDING)", channel.id(), state);
                return repository.save(subscription);
            }
            log.debug("Channel {} already registered in state {}", channel.id(), state);
            return subscription;
        }));
    }

    public Optional<ChannelSubscription> get(String channelId) {
        return repository.findById(channelId);
    }

    public Optional<ChannelSubscription> findByTopic(String topicUrl) {
        return repository.findByTopicUrl(topicUrl);
    }

    public List<ChannelSubscription> list() {
        return repository.findAll();
    }

    /**
     * Whether items for this channel should be ingested at all.
     */
    public boolean isTracked(String channelId) {
        return channelId != null && repository.findById(channelId)
                .map(s -> s.getState() != SubscriptionState.UNSUBSCRIBED)
                .orElse(false);
    }

    public ChannelSubscription markActive(String channelId, long leaseSeconds) {
        return mutate(channelId, subscription -> {
            if (subscription.getState() == SubscriptionState.UNSUBSCRIBED) {
                log.warn("Ignoring activation of unsubscribed channel {}", channelId);
                return false;
            }
            applyActive(subscription, leaseSeconds);
            return true;
        });
    }

    /**
     * Activates the channel after the hub accepted a subscribe request issued
     * at {@code requestedAt}. A handshake that arrived since then already set
     * the granted lease, which is kept.
     */
    public ChannelSubscription markAccepted(String channelId, long requestedLeaseSeconds, Instant requestedAt) {
        return mutate(channelId, subscription -> {
            if (subscription.getState() == SubscriptionState.UNSUBSCRIBED) {
                log.warn("Ignoring activation of unsubscribed channel {}", channelId);
                return false;
            }
            Instant confirmedAt = subscription.getLastRenewedAt();
            if (subscription.getState() == SubscriptionState.ACTIVE
                    && confirmedAt != null && !confirmedAt.isBefore(requestedAt)) {
                log.debug("Channel {} already confirmed by handshake at {}, keeping lease until {}",
                        channelId, confirmedAt, subscription.getLeaseExpiresAt());
                return false;
            }
            applyActive(subscription, requestedLeaseSeconds);
            return true;
        });
    }

    public ChannelSubscription markExpiring(String channelId) {
        return mutate(channelId, subscription -> {
            if (subscription.getState() != SubscriptionState.ACTIVE) {
                return false;
            }
            subscription.setState(SubscriptionState.EXPIRING);
            log.info("Channel {} EXPIRING (lease ends {})", channelId, subscription.getLeaseExpiresAt());
            return true;
        });
    }

    /**
     * Starts a fresh renewal cycle for a channel whose failed cool-down has
     * passed. Other states are left as they are.
     */
    public ChannelSubscription restartCycle(String channelId) {
        return mutate(channelId, subscription -> {
            if (subscription.getState() != SubscriptionState.FAILED) {
                return false;
            }
            subscription.setState(SubscriptionState.PENDING);
            subscription.setRenewalAttempts(0);
            subscription.setNextAttemptAt(null);
            log.info("Channel {} leaves FAILED after cool-down, retrying as PENDING", channelId);
            return true;
        });
    }

    /**
     * Ends the current renewal cycle for the channel. Other channels are not
     * affected; the channel becomes eligible again after the failed cool-down.
     */
    public ChannelSubscription markFailed(String channelId, String reason) {
        return mutate(channelId, subscription -> {
            if (subscription.getState() == SubscriptionState.UNSUBSCRIBED) {
                return false;
            }
            applyFailed(subscription, reason);
            return true;
        });
    }

    /**
     * Records one failed subscribe attempt. Schedules the next attempt with
     * exponential backoff, or marks the channel failed once the attempt budget
     * of the cycle is used up.
     */
    public ChannelSubscription recordRenewalFailure(String channelId, String reason, RenewalBackoff backoff) {
        return mutate(channelId, subscription -> {
            if (subscription.getState() == SubscriptionState.UNSUBSCRIBED) {
                return false;
            }
            int attempts = subscription.getRenewalAttempts() + 1;
            subscription.setRenewalAttempts(attempts);
            subscription.setStateReason(reason);
            if (attempts >= backoff.maxAttempts()) {
                applyFailed(subscription, reason);
            } else {
                Duration delay = backoff.delayAfter(attempts);
                subscription.setNextAttemptAt(clock.instant().plus(delay));
                log.warn("Renewal attempt {}/{} for channel {} failed: {}. Next attempt in {}",
                        attempts, backoff.maxAttempts(), channelId, reason, delay);
            }
            return true;
        });
    }

    public ChannelSubscription unsubscribe(String channelId) {
        return mutate(channelId, subscription -> {
            subscription.setState(SubscriptionState.UNSUBSCRIBED);
            subscription.setLeaseExpiresAt(null);
            subscription.setRenewalAttempts(0);
            subscription.setNextAttemptAt(null);
            subscription.setStateReason(null);
            log.info("Channel {} UNSUBSCRIBED", channelId);
            return true;
        });
    }

    private String topicUrlFor(String channelId) {
        return topicTemplate.replace("{channelId}", channelId);
    }

    private void applyActive(ChannelSubscription subscription, long leaseSeconds) {
        Instant now = clock.instant();
        subscription.setState(SubscriptionState.ACTIVE);
        subscription.setLeaseExpiresAt(now.plusSeconds(leaseSeconds));
        subscription.setLastRenewedAt(now);
        subscription.setStateReason(null);
        subscription.setRenewalAttempts(0);
        subscription.setNextAttemptAt(null);
        log.info("Channel {} ACTIVE, lease {}s until {}",
                subscription.getChannelId(), leaseSeconds, subscription.getLeaseExpiresAt());
    }

    private void applyFailed(ChannelSubscription subscription, String reason) {
        subscription.setState(SubscriptionState.FAILED);
        subscription.setStateReason(reason);
        subscription.setNextAttemptAt(clock.instant().plus(failedCooldown));
        metrics.recordSubscriptionFailed(subscription.getChannelId());
        log.error("ALERT: subscription for channel {} FAILED after {} attempts: {}",
                subscription.getChannelId(), subscription.getRenewalAttempts(), reason);
    }

    private ChannelSubscription mutate(String channelId, Predicate<ChannelSubscription> change) {
        return locks.withLock(channelId, () -> transactionTemplate.execute(status -> {
            ChannelSubscription subscription = repository.findById(channelId)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown channel: " + channelId));
            if (!change.test(subscription)) {
                return subscription;
            }
            subscription.setUpdatedAt(clock.instant());
            return repository.save(subscription);
        }));
    }
}
