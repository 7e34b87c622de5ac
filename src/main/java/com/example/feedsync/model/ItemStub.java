package com.example.feedsync.model;

import java.time.Instant;

/**
 * An item identifier awaiting enrichment.
 *
 * @param itemId             external item identifier
 * @param channelId          channel the item belongs to
 * @param candidateTimestamp published/updated time seen by the producer, may be null
 * @param origin             producer that saw the item
 */
public record ItemStub(
        String itemId,
        String channelId,
        Instant candidateTimestamp,
        ItemOrigin origin
) { }
