package com.example.feedsync.service;

import com.example.feedsync.ingestion.IngestionQueue;
import com.example.feedsync.model.SubscriptionState;
import com.example.feedsync.repository.ChannelSubscriptionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodic summary of the pipeline in the logs, with warnings when something
 * needs an operator.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionStatisticsReporter {

    private final IngestionMetrics metrics;
    private final IngestionQueue ingestionQueue;
    private final DeadLetterService deadLetters;
    private final ChannelSubscriptionRepository subscriptionRepository;

    @Scheduled(fixedRateString = "${app.statistics.rate-ms:300000}", initialDelayString = "${app.statistics.rate-ms:300000}")
    public void logStatistics() {
        try {
            long deadLetterCount = deadLetters.count();
            long failed = subscriptionRepository.countByState(SubscriptionState.FAILED);
            long active = subscriptionRepository.countByState(SubscriptionState.ACTIVE);
            int depth = ingestionQueue.depth();
            int remaining = ingestionQueue.remainingCapacity();

            log.info("=== INGESTION STATISTICS ===");
            log.info("Subscriptions - Active: {}, Expiring: {}, Pending: {}, Failed: {}", active,
                    subscriptionRepository.countByState(SubscriptionState.EXPIRING),
                    subscriptionRepository.countByState(SubscriptionState.PENDING), failed);
            log.info("Pushes - Received: {}, Bad signature: {}, Backpressure: {}",
                    metrics.getPushReceivedCount(), metrics.getSignatureRejectedCount(), metrics.getBackpressureRejectedCount());
            log.info("Records - Inserted: {}, Updated: {}, Not found: {}, Dropped entries: {}",
                    metrics.getInsertedCount(), metrics.getUpdatedCount(), metrics.getNotFoundCount(),
                    metrics.getEntriesDroppedCount());
            log.info("Queue - Depth: {}, Free: {}; Retries: {}; Dead letters: {}",
                    depth, remaining, metrics.getRetriesCount(), deadLetterCount);
            log.info("============================");

            if (failed > 0) {
                log.warn("HIGH ALERT: {} channel subscription(s) FAILED - no pushes arrive for them", failed);
            }
            if (remaining == 0) {
                log.warn("HIGH ALERT: ingestion queue is full - hub pushes are being refused");
            }
            if (deadLetterCount > 50) {
                log.warn("HIGH ALERT: {} dead letters - check the metadata source", deadLetterCount);
            }
        } catch (Exception ex) {
            log.error("Failed to log ingestion statistics: {}", ex.getMessage(), ex);
        }
    }
}
