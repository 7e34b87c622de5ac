package com.example.feedsync.ingestion;

public enum EnrichmentOutcome {
    INSERTED,
    UPDATED,
    NOT_FOUND,
    DEAD_LETTERED
}
