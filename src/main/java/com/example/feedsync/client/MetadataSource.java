package com.example.feedsync.client;

import com.example.feedsync.model.ItemMetadata;

import java.util.List;

/**
 * External source of item metadata and channel listings.
 */
public interface MetadataSource {

    /**
     * @throws com.example.feedsync.exception.ItemNotFoundException   item withdrawn or private
     * @throws com.example.feedsync.exception.TransientFetchException timeout, rate limit or transport failure
     */
    ItemMetadata fetchItem(String itemId);

    /**
     * Most recent item identifiers of a channel, newest first.
     *
     * @throws com.example.feedsync.exception.TransientFetchException timeout, rate limit or transport failure
     */
    List<String> listRecentItemIds(String channelId, int limit);
}
