package com.example.feedsync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;

/**
 * Full item description returned by the metadata source.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ItemMetadata(
        String itemId,
        String title,
        String url,
        String channelId,
        String channelName,
        Instant publishedAt,
        Long viewCount,
        Long likeCount,
        Long commentCount,
        Long durationSeconds,
        List<String> tags,
        String description,
        String thumbnailUrl
) { }
