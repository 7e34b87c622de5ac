package com.example.feedsync.service;

import com.example.feedsync.ingestion.EnrichmentOutcome;
import com.example.feedsync.ingestion.MetadataEnricher;
import com.example.feedsync.model.DeadLetter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Feeds dead letters back through enrichment. Off by default; the internal API
 * can trigger a run either way.
 */
@Slf4j
@Component
public class DeadLetterReprocessor {

    private final DeadLetterService deadLetters;
    private final MetadataEnricher enricher;

    @Value("${app.dead-letter.retry-enabled:false}")
    private boolean retryEnabled;

    public DeadLetterReprocessor(DeadLetterService deadLetters, MetadataEnricher enricher) {
        this.deadLetters = deadLetters;
        this.enricher = enricher;
    }

    @Scheduled(fixedDelayString = "${app.dead-letter.retry-delay-ms:900000}")
    public void retryDeadLetters() {
        if (!retryEnabled) {
            return;
        }
        reprocessAll();
    }

    /**
     * @return how many dead letters ended in each outcome
     */
    public Map<EnrichmentOutcome, Integer> reprocessAll() {
        Map<EnrichmentOutcome, Integer> outcomes = new EnumMap<>(EnrichmentOutcome.class);
        for (DeadLetter letter : deadLetters.list()) {
            EnrichmentOutcome outcome;
            try {
                outcome = enricher.enrich(letter.toStub());
                if (outcome == EnrichmentOutcome.NOT_FOUND) {
                    // nothing left to retry
                    deadLetters.resolve(letter.getItemId());
                }
            } catch (RuntimeException ex) {
                log.error("❌ Reprocessing dead letter for item {} failed: {}", letter.getItemId(), ex.getMessage(), ex);
                outcome = EnrichmentOutcome.DEAD_LETTERED;
            }
            outcomes.merge(outcome, 1, Integer::sum);
        }
        if (!outcomes.isEmpty()) {
            log.info("Reprocessed dead letters: {}", outcomes);
        }
        return outcomes;
    }
}
