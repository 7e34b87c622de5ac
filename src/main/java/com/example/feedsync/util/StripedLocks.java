package com.example.feedsync.util;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Fixed pool of locks selected by key hash. Work on the same key is serialized,
 * work on different keys mostly proceeds in parallel, and memory stays bounded
 * no matter how many distinct keys pass through.
 */
public final class StripedLocks {

    private final ReentrantLock[] stripes;

    public StripedLocks(int stripeCount) {
        if (stripeCount <= 0) {
            throw new IllegalArgumentException("stripeCount must be positive");
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public <T> T withLock(String key, Supplier<T> action) {
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    ReentrantLock lockFor(String key) {
        int hash = key.hashCode();
        hash ^= (hash >>> 16);
        return stripes[Math.floorMod(hash, stripes.length)];
    }
}
