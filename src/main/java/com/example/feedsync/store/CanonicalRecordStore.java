package com.example.feedsync.store;

import com.example.feedsync.model.CanonicalRecord;
import com.example.feedsync.model.ItemMetadata;
import com.example.feedsync.model.ItemOrigin;
import com.example.feedsync.repository.CanonicalRecordRepository;
import com.example.feedsync.util.StripedLocks;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * The single point of deduplication for items, whichever producer reaches it
 * first.
 *
 * <p>Merge policy: on insert the first-seen timestamp and origin are set from
 * the incoming write and never touched again; every other field is overwritten
 * by each later write and {@code lastUpdatedAt} moves to now. Writes to the
 * same item id are serialized, writes to different ids run in parallel.
 */
@Slf4j
@Service
public class CanonicalRecordStore {

    private final CanonicalRecordRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final StripedLocks locks = new StripedLocks(64);

    public CanonicalRecordStore(CanonicalRecordRepository repository,
                                PlatformTransactionManager transactionManager,
                                Clock clock) {
        this.repository = repository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    public UpsertResult upsert(ItemMetadata metadata, ItemOrigin origin) {
        String itemId = metadata.itemId();
        if (itemId == null || itemId.isBlank()) {
            throw new IllegalArgumentException("Cannot store a record without an item id");
        }
        log.debug("Upserting record with itemId: {}", itemId);

        try {
            return locks.withLock(itemId, () -> writeOnce(metadata, origin));
        } catch (DataIntegrityViolationException ex) {
            // a concurrent writer outside this process inserted first; merge into its row
            log.info("Concurrent insert detected for itemId {}, retrying as merge", itemId);
            return locks.withLock(itemId, () -> writeOnce(metadata, origin));
        }
    }

    public Optional<CanonicalRecord> find(String itemId) {
        return repository.findById(itemId);
    }

    /**
     * Records of a channel published within {@code [from, to]}, newest first.
     */
    public List<CanonicalRecord> findByChannel(String channelId, Instant from, Instant to) {
        return repository.findByChannelIdAndPublishedAtBetweenOrderByPublishedAtDesc(channelId, from, to);
    }

    public List<CanonicalRecord> findRecent(int limit) {
        return repository.findAllByOrderByPublishedAtDesc(PageRequest.of(0, Math.max(1, limit)));
    }

    public long count() {
        return repository.count();
    }

    private UpsertResult writeOnce(ItemMetadata metadata, ItemOrigin origin) {
        return transactionTemplate.execute(status -> {
            Instant now = clock.instant();
            Optional<CanonicalRecord> existing = repository.findById(metadata.itemId());
            if (existing.isPresent()) {
                CanonicalRecord record = existing.get();
                applyMutableFields(record, metadata, origin, now);
                log.debug("Merged record {} (first seen {} via {})",
                        record.getItemId(), record.getFirstSeenAt(), record.getFirstSeenOrigin());
                return new UpsertResult(repository.save(record), false);
            }

            CanonicalRecord record = new CanonicalRecord();
            record.setItemId(metadata.itemId());
            record.setFirstSeenAt(now);
            record.setFirstSeenOrigin(origin);
            applyMutableFields(record, metadata, origin, now);
            log.debug("Inserted record {} via {}", record.getItemId(), origin);
            return new UpsertResult(repository.saveAndFlush(record), true);
        });
    }

    private void applyMutableFields(CanonicalRecord record, ItemMetadata metadata, ItemOrigin origin, Instant now) {
        record.setTitle(metadata.title());
        record.setUrl(metadata.url());
        record.setChannelId(metadata.channelId());
        record.setChannelName(metadata.channelName());
        record.setPublishedAt(metadata.publishedAt());
        record.setViewCount(orZero(metadata.viewCount()));
        record.setLikeCount(orZero(metadata.likeCount()));
        record.setCommentCount(orZero(metadata.commentCount()));
        record.setDurationSeconds(orZero(metadata.durationSeconds()));
        record.getTags().clear();
        if (metadata.tags() != null) {
            record.getTags().addAll(metadata.tags());
        }
        record.setDescription(truncate(metadata.description()));
        record.setThumbnailUrl(metadata.thumbnailUrl());
        record.setLastUpdatedAt(now);
        record.setLastUpdatedOrigin(origin);
    }

    private static long orZero(Long value) {
        return value != null ? value : 0L;
    }

    private static String truncate(String description) {
        if (description == null || description.length() <= CanonicalRecord.MAX_DESCRIPTION_LENGTH) {
            return description;
        }
        return description.substring(0, CanonicalRecord.MAX_DESCRIPTION_LENGTH);
    }
}
