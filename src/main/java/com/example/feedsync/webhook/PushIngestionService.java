package com.example.feedsync.webhook;

import com.example.feedsync.exception.MalformedFeedException;
import com.example.feedsync.exception.SignatureVerificationException;
import com.example.feedsync.ingestion.FeedParseResult;
import com.example.feedsync.ingestion.FeedParser;
import com.example.feedsync.ingestion.IngestionQueue;
import com.example.feedsync.model.PushNotification;
import com.example.feedsync.registry.SubscriptionRegistry;
import com.example.feedsync.service.IngestionMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Synchronous part of push handling: verify, parse, enqueue. Enrichment
 * happens later on the queue workers, so the hub gets its answer quickly.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PushIngestionService {

    private static final Pattern SELF_LINK = Pattern.compile("<([^>]+)>\\s*;\\s*rel=\"?self\"?");

    private final WebhookVerifier verifier;
    private final FeedParser feedParser;
    private final IngestionQueue ingestionQueue;
    private final SubscriptionRegistry registry;
    private final IngestionMetrics metrics;

    /**
     * @return what the push contained; its stubs are already enqueued
     * @throws SignatureVerificationException             signature rejected, nothing enqueued
     * @throws MalformedFeedException                     body unreadable, nothing enqueued
     * @throws com.example.feedsync.exception.QueueFullException queue cannot take the batch, nothing enqueued
     */
    public FeedParseResult accept(PushNotification notification) {
        metrics.recordPushReceived();
        try {
            verifier.verifyPush(notification);
        } catch (SignatureVerificationException ex) {
            metrics.recordSignatureRejected();
            log.warn("Rejected push: {}", ex.getMessage());
            throw ex;
        }

        FeedParseResult result;
        try {
            result = feedParser.parse(notification.body(), registry::isTracked);
        } catch (MalformedFeedException ex) {
            metrics.recordMalformedPush();
            log.warn("Rejected push: {}", ex.getMessage());
            throw ex;
        }
        metrics.recordEntriesDropped(result.dropped());
        metrics.recordEntriesDeleted(result.deleted());

        ingestionQueue.submitAll(result.stubs());
        log.info("Accepted push with {} entries ({} queued, {} dropped)",
                result.totalEntries(), result.stubs().size(), result.dropped());
        return result;
    }

    public static String selfTopic(String linkHeader) {
        if (linkHeader == null) {
            return null;
        }
        Matcher matcher = SELF_LINK.matcher(linkHeader);
        return matcher.find() ? matcher.group(1) : null;
    }
}
