package com.example.feedsync.model;

/**
 * Which producer handed an item to the enrichment funnel.
 */
public enum ItemOrigin {
    PUSH,
    BACKFILL
}
