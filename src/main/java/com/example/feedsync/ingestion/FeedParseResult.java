package com.example.feedsync.ingestion;

import com.example.feedsync.model.ItemStub;

import java.util.List;

/**
 * @param stubs   entries that yielded a usable item for a tracked channel
 * @param dropped entries skipped for an unusable identifier or untracked channel
 * @param deleted tombstone entries announcing removed items
 */
public record FeedParseResult(List<ItemStub> stubs, int dropped, int deleted) {

    public int totalEntries() {
        return stubs.size() + dropped;
    }
}
