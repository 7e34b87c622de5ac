package com.example.feedsync.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The deduplicated, merged representation of one item. {@code firstSeenAt} and
 * {@code firstSeenOrigin} are written once on insert; every other field follows
 * the latest successful enrichment.
 */
@Getter
@Setter
@Entity
@Table(name = "canonical_records", indexes = {
        @Index(name = "idx_records_channel", columnList = "channel_id"),
        @Index(name = "idx_records_published", columnList = "published_at")
})
public class CanonicalRecord {

    public static final int MAX_DESCRIPTION_LENGTH = 2000;

    @Id
    @Column(name = "item_id", length = 64)
    private String itemId;

    @Column(length = 1024)
    private String title;

    @Column(length = 1024)
    private String url;

    @Column(name = "channel_id", length = 64)
    private String channelId;

    @Column(name = "channel_name")
    private String channelName;

    @Column(name = "published_at")
    private Instant publishedAt;

    @Column(name = "view_count")
    private long viewCount;

    @Column(name = "like_count")
    private long likeCount;

    @Column(name = "comment_count")
    private long commentCount;

    @Column(name = "duration_seconds")
    private long durationSeconds;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "canonical_record_tags", joinColumns = @JoinColumn(name = "item_id"))
    @OrderColumn(name = "position")
    @Column(name = "tag")
    private List<String> tags = new ArrayList<>();

    @Column(length = MAX_DESCRIPTION_LENGTH)
    private String description;

    @Column(name = "thumbnail_url", length = 1024)
    private String thumbnailUrl;

    @Column(name = "first_seen_at", nullable = false, updatable = false)
    private Instant firstSeenAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "first_seen_origin", nullable = false, updatable = false, length = 16)
    private ItemOrigin firstSeenOrigin;

    @Column(name = "last_updated_at", nullable = false)
    private Instant lastUpdatedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "last_updated_origin", nullable = false, length = 16)
    private ItemOrigin lastUpdatedOrigin;

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CanonicalRecord that = (CanonicalRecord) o;
        return Objects.equals(itemId, that.itemId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(itemId);
    }
}
