package com.example.feedsync.backfill;

import java.time.Instant;

/**
 * Summary of one backfill run for one channel.
 *
 * @param listingError why the listing could not be retrieved, or null
 * @param interrupted  the run stopped early because the service is shutting down
 */
public record BackfillReport(String channelId,
                             int listed,
                             int inserted,
                             int updated,
                             int notFound,
                             int deadLettered,
                             String listingError,
                             boolean interrupted,
                             Instant startedAt,
                             Instant finishedAt) {

    public int stored() {
        return inserted + updated;
    }

    public boolean successful() {
        return listingError == null && !interrupted;
    }
}
