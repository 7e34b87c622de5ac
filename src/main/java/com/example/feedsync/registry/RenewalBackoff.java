package com.example.feedsync.registry;

import java.time.Duration;

/**
 * Exponential delay between renewal attempts for one channel.
 *
 * @param maxAttempts    attempts per cycle before the channel is marked failed
 * @param initialBackoff delay after the first failure
 * @param maxBackoff     upper bound for any single delay
 */
public record RenewalBackoff(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {

    public RenewalBackoff {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
    }

    /**
     * @param failedAttempts number of failures so far, starting at 1
     */
    public Duration delayAfter(int failedAttempts) {
        int exponent = Math.max(0, Math.min(failedAttempts - 1, 30));
        Duration delay = initialBackoff.multipliedBy(1L << exponent);
        return delay.compareTo(maxBackoff) > 0 ? maxBackoff : delay;
    }
}
