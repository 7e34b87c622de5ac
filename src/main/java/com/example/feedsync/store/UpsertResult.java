package com.example.feedsync.store;

import com.example.feedsync.model.CanonicalRecord;

/**
 * @param record   the record as persisted after the write
 * @param inserted true when this write created the record
 */
public record UpsertResult(CanonicalRecord record, boolean inserted) {
}
