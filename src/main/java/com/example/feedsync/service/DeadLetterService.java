package com.example.feedsync.service;

import com.example.feedsync.model.DeadLetter;
import com.example.feedsync.model.ItemStub;
import com.example.feedsync.repository.DeadLetterRepository;
import com.example.feedsync.util.StripedLocks;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.List;

@Slf4j
@Service
public class DeadLetterService {

    private static final int MAX_REASON_LENGTH = 2000;

    private final DeadLetterRepository repository;
    private final IngestionMetrics metrics;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;
    private final StripedLocks locks = new StripedLocks(32);

    public DeadLetterService(DeadLetterRepository repository,
                             IngestionMetrics metrics,
                             Clock clock,
                             PlatformTransactionManager transactionManager) {
        this.repository = repository;
        this.metrics = metrics;
        this.clock = clock;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Persists (or refreshes) the dead-letter marker for a stub that could not be enriched.
     * Each write commits on its own; an insert that lost a race against another
     * writer is applied again as an update of the winning row.
     */
    public void record(ItemStub stub, String reason, int attempts) {
        String trimmed = reason != null && reason.length() > MAX_REASON_LENGTH ? reason.substring(0, MAX_REASON_LENGTH) : reason;
        try {
            locks.withLock(stub.itemId(), () -> writeOnce(stub, trimmed, attempts));
        } catch (DataIntegrityViolationException ex) {
            log.warn("Dead letter for item {} was written concurrently, merging: {}", stub.itemId(), ex.getMessage());
            locks.withLock(stub.itemId(), () -> writeOnce(stub, trimmed, attempts));
        }
        metrics.recordDeadLettered();
        log.error("Dead-lettered item {} (channel {}, origin {}) after {} attempts: {}",
                stub.itemId(), stub.channelId(), stub.origin(), attempts, trimmed);
    }

    /**
     * Drops the marker once the item has been stored.
     */
    public void resolve(String itemId) {
        long removed = repository.deleteByItemId(itemId);
        if (removed > 0) {
            log.info("Resolved dead letter for item {}", itemId);
        }
    }

    public List<DeadLetter> list() {
        return repository.findAll(Sort.by(Sort.Direction.DESC, "lastFailedAt"));
    }

    public long count() {
        return repository.count();
    }

    private DeadLetter writeOnce(ItemStub stub, String reason, int attempts) {
        return transactionTemplate.execute(status -> {
            DeadLetter letter = repository.findByItemId(stub.itemId())
                    .map(existing -> {
                        existing.recordFailure(reason, attempts, clock.instant());
                        return existing;
                    })
                    .orElseGet(() -> new DeadLetter(stub, reason, attempts, clock.instant()));
            return repository.saveAndFlush(letter);
        });
    }
}
